package pin.runtime.interpreter;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.expr.BinaryExpr;
import com.pinlang.compiler.ast.expr.Expression;
import com.pinlang.compiler.ast.expr.Identifier;
import com.pinlang.compiler.ast.expr.Literal;
import pin.runtime.*;

import java.util.logging.Logger;

/**
 * 表达式求值
 */
final class ExpressionEvaluator implements AstVisitor<PinValue, Environment> {

    private static final Logger LOG = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final Interpreter interp;

    ExpressionEvaluator(Interpreter interp) {
        this.interp = interp;
    }

    PinValue evaluate(Expression expr, Environment env) {
        return expr.accept(this, env);
    }

    @Override
    public PinValue visitLiteral(Literal node, Environment env) {
        return PinValue.fromJava(node.getValue());
    }

    @Override
    public PinValue visitIdentifier(Identifier node, Environment env) {
        PinValue value = env.get(node.getName());
        if (value == null) {
            throw interp.runtimeError("未定义的变量: " + node.getName(), node.getLine());
        }
        return value;
    }

    @Override
    public PinValue visitBinaryExpr(BinaryExpr node, Environment env) {
        PinValue left = evaluate(node.getLeft(), env);
        PinValue right = evaluate(node.getRight(), env);
        try {
            PinValue result = BinaryOps.apply(node.getOperator(), left, right);
            LOG.finer(() -> left.repr() + " " + node.getOperator().toSourceString() + " " + right.repr()
                    + " => " + result.repr());
            return result;
        } catch (PinException e) {
            throw interp.locate(e, node.getLine());
        }
    }
}
