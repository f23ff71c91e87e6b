package com.pinlang.compiler.ast.expr;

import com.pinlang.compiler.ast.AstNode;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
