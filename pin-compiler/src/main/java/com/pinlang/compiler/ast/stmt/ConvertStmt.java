package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 类型转换：zhuanhuan source shuzi = target
 */
public class ConvertStmt extends Statement {
    private final String source;
    private final TargetType targetType;
    private final String target;

    public ConvertStmt(SourceLocation location, String source, TargetType targetType, String target) {
        super(location);
        this.source = source;
        this.targetType = targetType;
        this.target = target;
    }

    public String getSource() {
        return source;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConvertStmt(this, context);
    }

    /**
     * 转换目标类型
     */
    public enum TargetType {
        NUMBER("shuzi"),
        STRING("zifu");

        private final String keyword;

        TargetType(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
