package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.Modifier;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.StateMutability;
import com.cypherlang.compiler.ast.Visibility;
import com.cypherlang.compiler.ast.stmt.Statement;
import com.cypherlang.compiler.ast.type.TypeNode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 函数声明
 */
public class FunctionDecl extends Declaration {
    private final List<Parameter> params;
    private final TypeNode returnType;  // 可选
    private final Set<Modifier> modifiers;
    private final Visibility visibility;
    private final StateMutability stateMutability;  // 可选
    private final List<Statement> body;

    public FunctionDecl(SourceLocation location, String name, List<Parameter> params,
                        TypeNode returnType, Set<Modifier> modifiers,
                        Visibility visibility, StateMutability stateMutability,
                        List<Statement> body) {
        super(location, name);
        this.params = List.copyOf(params);
        this.returnType = returnType;
        this.modifiers = modifiers.isEmpty()
                ? Collections.<Modifier>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
        this.visibility = visibility != null ? visibility : Visibility.PUBLIC;
        this.stateMutability = stateMutability;
        this.body = List.copyOf(body);
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    public Set<Modifier> getModifiers() {
        return modifiers;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public Visibility getVisibility() {
        return visibility;
    }

    /** 声明的可变性，未声明时为 null */
    public StateMutability getStateMutability() {
        return stateMutability;
    }

    public boolean isMpc() {
        return stateMutability == StateMutability.MPC;
    }

    public boolean isPrivate() {
        return visibility == Visibility.PRIVATE;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
