package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 跳转标记，如 hang_start
 */
public class LabelStmt extends Statement {
    public static final String PREFIX = "hang_";

    private final String name;

    public LabelStmt(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLabelStmt(this, context);
    }
}
