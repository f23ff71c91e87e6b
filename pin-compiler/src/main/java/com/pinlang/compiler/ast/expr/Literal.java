package com.pinlang.compiler.ast.expr;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofInteger(SourceLocation location, long value) {
        return new Literal(location, value, LiteralKind.INTEGER);
    }

    public static Literal ofFloat(SourceLocation location, double value) {
        return new Literal(location, value, LiteralKind.FLOAT);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    /** INTEGER 为 Long，FLOAT 为 Double，STRING 为 String */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        return kind == LiteralKind.STRING ? "'" + value + "'" : String.valueOf(value);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INTEGER,
        FLOAT,
        STRING;

        public boolean isNumeric() {
            return this != STRING;
        }
    }
}
