package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.Expression;

/**
 * 列表取值：liebiao huoqu list bianhao = index chuandi bl = target
 */
public class ListGetStmt extends Statement {
    private final String listName;
    private final Expression index;
    private final String target;

    public ListGetStmt(SourceLocation location, String listName, Expression index, String target) {
        super(location);
        this.listName = listName;
        this.index = index;
        this.target = target;
    }

    public String getListName() {
        return listName;
    }

    public Expression getIndex() {
        return index;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListGetStmt(this, context);
    }
}
