package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstNode;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
