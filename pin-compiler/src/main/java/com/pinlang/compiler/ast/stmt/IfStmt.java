package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 条件语句：panduan cond: ... fouze: ...
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final List<Statement> thenBody;
    private final List<Statement> elseBody;  // 没有 fouze 时为空列表

    public IfStmt(SourceLocation location, Expression condition,
                  List<Statement> thenBody, List<Statement> elseBody) {
        super(location);
        this.condition = condition;
        this.thenBody = Collections.unmodifiableList(thenBody);
        this.elseBody = Collections.unmodifiableList(elseBody);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBody() {
        return thenBody;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    public boolean hasElse() {
        return !elseBody.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
