package com.pinlang.compiler.ast.expr;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.lexer.TokenType;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.toSourceString() + " " + right + ")";
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),

        // 比较
        GT(">"),
        LT("<"),
        GE(">="),
        LE("<="),
        EQ("="),
        NE("=!");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isComparison() {
            return ordinal() >= GT.ordinal();
        }

        /**
         * 由操作符 token 类型得到运算符
         *
         * @throws IllegalArgumentException 不是二元运算符
         */
        public static BinaryOp fromToken(TokenType type) {
            switch (type) {
                case PLUS:       return ADD;
                case MINUS:      return SUB;
                case MULTIPLY:   return MUL;
                case DIVIDE:     return DIV;
                case GT:         return GT;
                case LT:         return LT;
                case GE:         return GE;
                case LE:         return LE;
                case EQUALS:     return EQ;
                case NOT_EQUALS: return NE;
                default:
                    throw new IllegalArgumentException("Not a binary operator: " + type);
            }
        }
    }
}
