package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.Expression;

/**
 * 计算语句：jisuan a + b = target
 */
public class CalculateStmt extends Statement {
    private final Expression expression;
    private final String target;

    public CalculateStmt(SourceLocation location, Expression expression, String target) {
        super(location);
        this.expression = expression;
        this.target = target;
    }

    public Expression getExpression() {
        return expression;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCalculateStmt(this, context);
    }
}
