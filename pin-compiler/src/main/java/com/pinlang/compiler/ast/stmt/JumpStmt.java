package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 跳转语句：tiao ciwenjian hang = 5
 */
public class JumpStmt extends Statement {
    public static final String KIND_LINE = "hang";
    public static final String KIND_INPUT = "shuru";
    public static final String KIND_LABEL = "label";

    private final String fileName;     // null 表示 ciwenjian（当前文件）
    private final String targetKind;
    private final String targetValue;

    public JumpStmt(SourceLocation location, String fileName, String targetKind, String targetValue) {
        super(location);
        this.fileName = fileName;
        this.targetKind = targetKind;
        this.targetValue = targetValue;
    }

    public String getFileName() {
        return fileName;
    }

    public boolean isCurrentFile() {
        return fileName == null;
    }

    public String getTargetKind() {
        return targetKind;
    }

    public String getTargetValue() {
        return targetValue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJumpStmt(this, context);
    }
}
