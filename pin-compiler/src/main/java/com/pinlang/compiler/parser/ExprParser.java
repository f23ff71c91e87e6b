package com.pinlang.compiler.parser;

import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.*;
import com.pinlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pinlang.compiler.lexer.Token;

import static com.pinlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <pre>
 * expression     := comparison
 * comparison     := additive (('&gt;' | '&lt;' | '&gt;=' | '&lt;=' | '=' | '=!') additive)*
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := factor (('*' | '/') factor)*
 * factor         := '(' expression ')' | INTEGER | FLOAT | STRING | ID
 * </pre>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseComparisonExpr();
    }

    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();
        while (parser.current.getType().isComparisonOp()) {
            Token op = parser.advance();
            Expression right = parseAdditiveExpr();
            left = new BinaryExpr(parser.location(op), left, BinaryOp.fromToken(op.getType()), right);
        }
        return left;
    }

    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpr(parser.location(op), left, BinaryOp.fromToken(op.getType()), right);
        }
        return left;
    }

    private Expression parseMultiplicativeExpr() {
        Expression left = parseFactor();
        while (parser.checkAny(MULTIPLY, DIVIDE)) {
            Token op = parser.advance();
            Expression right = parseFactor();
            left = new BinaryExpr(parser.location(op), left, BinaryOp.fromToken(op.getType()), right);
        }
        return left;
    }

    private Expression parseFactor() {
        if (parser.match(LPAREN)) {
            Expression inner = parseExpression();
            parser.expect(RPAREN);
            return inner;
        }
        if (parser.checkAny(INTEGER, FLOAT, STRING)) {
            return literal(parser.advance());
        }
        if (parser.check(ID)) {
            Token name = parser.advance();
            return new Identifier(parser.location(name), name.getLexeme());
        }
        throw parser.error("无效的表达式: " + parser.current.getLexeme());
    }

    /**
     * 由字面量 token 构造 Literal 节点
     */
    Literal literal(Token token) {
        SourceLocation loc = parser.location(token);
        switch (token.getType()) {
            case INTEGER:
                return Literal.ofInteger(loc, (Long) token.getLiteral());
            case FLOAT:
                return Literal.ofFloat(loc, (Double) token.getLiteral());
            case STRING:
                return Literal.ofString(loc, (String) token.getLiteral());
            default:
                throw new ParseException("无效的表达式: " + token.getLexeme(), token, parser.fileName);
        }
    }
}
