package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 列表创建：liebiao chuangjian name = [a, b, ...]
 */
public class ListCreateStmt extends Statement {
    private final String name;
    private final List<Expression> elements;

    public ListCreateStmt(SourceLocation location, String name, List<Expression> elements) {
        super(location);
        this.name = name;
        this.elements = Collections.unmodifiableList(elements);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListCreateStmt(this, context);
    }
}
