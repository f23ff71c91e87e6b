package com.pinlang.compiler.ast;

import com.pinlang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 程序：按源码顺序排列的顶层语句。
 *
 * <p>语句顺序决定默认的顺序执行和跳转目标下标。</p>
 */
public final class Program {
    private final String fileName;
    private final List<Statement> statements;

    public Program(String fileName, List<Statement> statements) {
        this.fileName = fileName;
        this.statements = Collections.unmodifiableList(statements);
    }

    public String getFileName() {
        return fileName;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
