package com.pinlang.compiler.ast.stmt;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pinlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 循环语句
 *
 * <pre>
 * xunhuan i &lt; 5:        # 条件循环
 * xunhuan cishu = 3:     # 计数循环
 * </pre>
 *
 * <p>变量、比较符和比较值三者齐全时为条件循环，否则按次数循环。</p>
 */
public class LoopStmt extends Statement {
    private final String variable;          // 可选
    private final BinaryOp compareOp;       // 可选
    private final Expression compareValue;  // 可选
    private final Expression count;         // 可选
    private final List<Statement> body;

    public LoopStmt(SourceLocation location, String variable, BinaryOp compareOp,
                    Expression compareValue, Expression count, List<Statement> body) {
        super(location);
        this.variable = variable;
        this.compareOp = compareOp;
        this.compareValue = compareValue;
        this.count = count;
        this.body = Collections.unmodifiableList(body);
    }

    public String getVariable() {
        return variable;
    }

    public BinaryOp getCompareOp() {
        return compareOp;
    }

    public Expression getCompareValue() {
        return compareValue;
    }

    public Expression getCount() {
        return count;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isConditional() {
        return variable != null && compareOp != null && compareValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopStmt(this, context);
    }
}
