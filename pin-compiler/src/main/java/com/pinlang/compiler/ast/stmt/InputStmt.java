package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;

/**
 * 输入语句：shuru('提示') = target [jin(zifu)]
 */
public class InputStmt extends Statement {
    private final String prompt;
    private final String target;
    private final String restriction;  // 可选，如 "zifu"

    public InputStmt(SourceLocation location, String prompt, String target, String restriction) {
        super(location);
        this.prompt = prompt;
        this.target = target;
        this.restriction = restriction;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getTarget() {
        return target;
    }

    public String getRestriction() {
        return restriction;
    }

    /** jin(zifu)：禁止字符，只接受数字 */
    public boolean isNumericOnly() {
        return "zifu".equals(restriction);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInputStmt(this, context);
    }
}
