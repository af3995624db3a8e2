package com.cypherlang.compiler.parser;

import com.cypherlang.compiler.ast.Modifier;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.StateMutability;
import com.cypherlang.compiler.ast.Visibility;
import com.cypherlang.compiler.ast.decl.*;
import com.cypherlang.compiler.ast.expr.RawExpression;
import com.cypherlang.compiler.ast.stmt.Statement;
import com.cypherlang.compiler.ast.type.PrimitiveType;
import com.cypherlang.compiler.ast.type.TypeNode;
import com.cypherlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.cypherlang.compiler.lexer.TokenType.*;

/**
 * 声明解析：合约及其成员
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 合约 ============

    /**
     * contract := 'contract' NAME '{' (function | circuit | stateVariable)* '}'
     */
    Contract parseContract() {
        SourceLocation loc = parser.location();
        parser.expect(CONTRACT, "Expected 'contract'");
        String name = parser.expect(IDENTIFIER, "Expected contract name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after contract name");

        List<FunctionDecl> functions = new ArrayList<>();
        List<Circuit> circuits = new ArrayList<>();
        List<StateVariable> stateVariables = new ArrayList<>();

        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.check(FUNCTION)) {
                functions.add(parseFunction());
            } else if (parser.check(CIRCUIT)) {
                circuits.add(parseCircuit());
            } else if (parser.isTypeStart()) {
                stateVariables.add(parseStateVariable());
            } else {
                throw parser.error("Expected function, circuit or state variable in contract '" + name + "'",
                        "FUNCTION, CIRCUIT or type");
            }
        }

        parser.expect(RBRACE, "Expected '}' after contract body");
        return new Contract(loc, name, functions, circuits, stateVariables);
    }

    // ============ 状态变量 ============

    /**
     * stateVariable := type NAME ('public' | 'private')? ';'
     */
    StateVariable parseStateVariable() {
        SourceLocation loc = parser.location();
        TypeNode type = parser.parseType();
        String name = parser.expectName("Expected variable name");

        Visibility visibility = Visibility.PRIVATE;
        if (parser.match(PUBLIC)) {
            visibility = Visibility.PUBLIC;
        } else {
            parser.match(PRIVATE);
        }

        parser.expect(SEMICOLON, "Expected ';' after state variable");
        return new StateVariable(loc, name, type, visibility);
    }

    // ============ 函数 ============

    /**
     * function := 'function' NAME '(' (type NAME (',' type NAME)*)? ')' ('->' type)? modifier* '{' statement* '}'
     */
    FunctionDecl parseFunction() {
        SourceLocation loc = parser.location();
        parser.expect(FUNCTION, "Expected 'function'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();

        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation paramLoc = parser.location();
                TypeNode paramType = parser.parseType();
                String paramName = parser.expectName("Expected parameter name");
                params.add(new Parameter(paramLoc, paramName, paramType));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        TypeNode returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.parseType();
        }

        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        Visibility visibility = null;
        StateMutability mutability = null;
        while (parser.current().getType().isFunctionModifier()) {
            Token token = parser.current();
            Modifier modifier = Modifier.fromTokenType(token.getType());
            if (modifier.isVisibility()) {
                if (visibility != null) {
                    throw parser.error("Duplicate visibility modifier on function '" + name + "'", "'{'");
                }
                visibility = modifier.toVisibility();
            } else {
                if (mutability != null) {
                    throw parser.error("Duplicate state mutability modifier on function '" + name + "'", "'{'");
                }
                mutability = modifier.toStateMutability();
            }
            modifiers.add(modifier);
            parser.advance();
        }

        parser.expect(LBRACE, "Expected '{' before function body");
        List<Statement> body = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            body.add(parser.parseStatement());
        }
        parser.expect(RBRACE, "Expected '}' after function body");

        return new FunctionDecl(loc, name, params, returnType, modifiers,
                visibility != null ? visibility : Visibility.PUBLIC, mutability, body);
    }

    // ============ 电路 ============

    /**
     * circuit := 'circuit' NAME '{' (visibility 'witness'? type NAME ';' | 'constraint' expression ';')* '}'
     */
    Circuit parseCircuit() {
        SourceLocation loc = parser.location();
        parser.expect(CIRCUIT, "Expected 'circuit'");
        String name = parser.expect(IDENTIFIER, "Expected circuit name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after circuit name");

        List<CircuitInput> inputs = new ArrayList<>();
        List<Constraint> constraints = new ArrayList<>();

        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.checkAny(PUBLIC, PRIVATE)) {
                inputs.add(parseCircuitInput());
            } else if (parser.check(CONSTRAINT)) {
                SourceLocation constraintLoc = parser.location();
                parser.advance();
                RawExpression expr = parser.parseExpression();
                parser.expect(SEMICOLON, "Expected ';' after constraint");
                constraints.add(new Constraint(constraintLoc, expr));
            } else {
                throw parser.error("Expected circuit input or constraint in circuit '" + name + "'",
                        "PUBLIC, PRIVATE or CONSTRAINT");
            }
        }

        parser.expect(RBRACE, "Expected '}' after circuit body");
        return new Circuit(loc, name, inputs, constraints);
    }

    private CircuitInput parseCircuitInput() {
        SourceLocation loc = parser.location();
        Visibility visibility = parser.advance().is(PUBLIC) ? Visibility.PUBLIC : Visibility.PRIVATE;

        boolean witness = false;
        TypeNode type;
        if (parser.check(WITNESS) && Parser.isNameToken(parser.peekNext()) && parser.peek(2).is(SEMICOLON)) {
            // `private witness secret;`：witness 本身就是类型
            witness = true;
            type = new PrimitiveType(parser.location(), parser.advance().getLexeme());
        } else {
            witness = parser.match(WITNESS);
            type = parser.parseType();
        }

        String name = parser.expectName("Expected input name");
        parser.expect(SEMICOLON, "Expected ';' after circuit input");
        return new CircuitInput(loc, name, type, visibility, witness);
    }
}
