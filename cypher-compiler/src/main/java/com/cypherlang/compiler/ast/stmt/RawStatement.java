package com.cypherlang.compiler.ast.stmt;

import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.TokenText;
import com.cypherlang.compiler.lexer.Token;
import com.cypherlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 未解析的函数体语句。
 *
 * <p>解析器只划分语句边界，不为其构建表达式树，
 * token 原样保留。结构化的语句语法会用
 * {@link Statement} 的专门子类替换该节点。</p>
 */
public final class RawStatement extends Statement {
    private final List<Token> tokens;

    public RawStatement(SourceLocation location, List<Token> tokens) {
        super(location);
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /** 第一个 token 的类型，例如 {@code RETURN} 或 {@code REQUIRE} */
    public TokenType getLeadingType() {
        return tokens.isEmpty() ? TokenType.EOF : tokens.get(0).getType();
    }

    public String getText() {
        return TokenText.join(tokens);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRawStatement(this, context);
    }

    @Override
    public String toString() {
        return getText();
    }
}
