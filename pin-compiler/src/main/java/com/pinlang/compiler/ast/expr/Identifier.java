package com.pinlang.compiler.ast.expr;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 变量引用
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
