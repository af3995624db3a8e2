package com.cypherlang.compiler.ast.expr;

import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.TokenText;
import com.cypherlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 未解析的约束表达式：直到结束 {@code ;} 之前的 token。
 *
 * <p>为优先级爬升表达式解析器预留的占位节点，后端只
 * 回显其文本。</p>
 */
public final class RawExpression extends Expression {
    private final List<Token> tokens;

    public RawExpression(SourceLocation location, List<Token> tokens) {
        super(location);
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("expression needs at least one token");
        }
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public String getText() {
        return TokenText.join(tokens);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRawExpression(this, context);
    }

    @Override
    public String toString() {
        return getText();
    }
}
