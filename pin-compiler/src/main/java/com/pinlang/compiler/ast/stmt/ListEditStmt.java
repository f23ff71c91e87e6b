package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.Expression;

/**
 * 列表修改：liebiao bianji list bianhao = index chuandi value
 */
public class ListEditStmt extends Statement {
    private final String listName;
    private final Expression index;
    private final Expression value;

    public ListEditStmt(SourceLocation location, String listName, Expression index, Expression value) {
        super(location);
        this.listName = listName;
        this.index = index;
        this.value = value;
    }

    public String getListName() {
        return listName;
    }

    public Expression getIndex() {
        return index;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListEditStmt(this, context);
    }
}
