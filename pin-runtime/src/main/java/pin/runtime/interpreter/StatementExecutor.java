package pin.runtime.interpreter;

import com.pinlang.compiler.ast.AstVisitor;
import com.pinlang.compiler.ast.expr.BinaryExpr;
import com.pinlang.compiler.ast.expr.Expression;
import com.pinlang.compiler.ast.stmt.*;
import pin.runtime.*;

import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

/**
 * 语句执行。返回 {@link JumpSignal} 表示要跳转，返回 null 表示顺序执行。
 */
final class StatementExecutor implements AstVisitor<JumpSignal, Environment> {

    private static final Logger LOG = Logger.getLogger(StatementExecutor.class.getName());

    private final Interpreter interp;
    private final ExpressionEvaluator evaluator;

    StatementExecutor(Interpreter interp, ExpressionEvaluator evaluator) {
        this.interp = interp;
        this.evaluator = evaluator;
    }

    JumpSignal execute(Statement stmt, Environment env) {
        return stmt.accept(this, env);
    }

    /**
     * 依次执行代码块，遇到跳转信号立即返回
     */
    private JumpSignal executeBody(List<Statement> body, Environment env) {
        for (Statement stmt : body) {
            JumpSignal signal = execute(stmt, env);
            if (signal != null) {
                return signal;
            }
        }
        return null;
    }

    // ============ 赋值类语句 ============

    @Override
    public JumpSignal visitPrintStmt(PrintStmt node, Environment env) {
        PinValue value;
        try {
            value = evaluator.evaluate(node.getValue(), env);
        } catch (PinException e) {
            throw interp.runtimeError("打印时发生错误: " + e.getRawMessage(), node.getLine(), e);
        }
        interp.getStdout().println(value.asString());
        return null;
    }

    @Override
    public JumpSignal visitVarDeclStmt(VarDeclStmt node, Environment env) {
        env.define(node.getName(), evaluator.evaluate(node.getValue(), env));
        return null;
    }

    @Override
    public JumpSignal visitListCreateStmt(ListCreateStmt node, Environment env) {
        PinList list = new PinList();
        for (Expression element : node.getElements()) {
            list.add(evaluator.evaluate(element, env));
        }
        env.define(node.getName(), list);
        return null;
    }

    @Override
    public JumpSignal visitListGetStmt(ListGetStmt node, Environment env) {
        PinList list = lookupList(node.getListName(), node.getLine(), env);
        int index = checkIndex(list, evaluator.evaluate(node.getIndex(), env), node.getLine());
        env.define(node.getTarget(), list.get(index));
        return null;
    }

    @Override
    public JumpSignal visitListEditStmt(ListEditStmt node, Environment env) {
        PinList list = lookupList(node.getListName(), node.getLine(), env);
        int index = checkIndex(list, evaluator.evaluate(node.getIndex(), env), node.getLine());
        list.set(index, evaluator.evaluate(node.getValue(), env));
        return null;
    }

    private PinList lookupList(String name, int line, Environment env) {
        PinValue value = env.get(name);
        if (value == null) {
            throw interp.runtimeError("未定义的列表: " + name, line);
        }
        if (!(value instanceof PinList)) {
            throw interp.runtimeError(name + " 不是一个列表", line);
        }
        return (PinList) value;
    }

    private int checkIndex(PinList list, PinValue index, int line) {
        if (!index.isInteger()) {
            throw interp.runtimeError("列表索引必须是整数，但得到了 " + index.getTypeName(), line);
        }
        long i = index.asLong();
        if (i < 0 || i >= list.size()) {
            throw interp.runtimeError("列表索引越界: " + i + ", 列表长度: " + list.size(), line);
        }
        return (int) i;
    }

    @Override
    public JumpSignal visitCalculateStmt(CalculateStmt node, Environment env) {
        env.define(node.getTarget(), evaluator.evaluate(node.getExpression(), env));
        return null;
    }

    @Override
    public JumpSignal visitConvertStmt(ConvertStmt node, Environment env) {
        PinValue value = env.get(node.getSource());
        if (value == null) {
            throw interp.runtimeError("未定义的变量: " + node.getSource(), node.getLine());
        }
        PinValue result;
        try {
            result = TypeConversions.convert(value, node.getTargetType());
        } catch (PinException e) {
            throw interp.locate(e, node.getLine());
        }
        env.define(node.getTarget(), result);
        return null;
    }

    @Override
    public JumpSignal visitInputStmt(InputStmt node, Environment env) {
        PinValue result;
        if (node.isNumericOnly()) {
            // jin(zifu)：直到输入数字为止
            while (true) {
                String text = readLine(node);
                PinValue number;
                try {
                    number = TypeConversions.parseNumber(text);
                } catch (PinException e) {
                    throw interp.locate(e, node.getLine());
                }
                if (number != null) {
                    result = number;
                    break;
                }
                interp.getStdout().println("错误：请输入数字");
            }
        } else {
            result = PinString.of(readLine(node));
        }
        env.define(node.getTarget(), result);
        return null;
    }

    private String readLine(InputStmt node) {
        interp.getStdout().print(node.getPrompt());
        interp.getStdout().flush();
        String line;
        try {
            line = interp.getStdin().readLine();
        } catch (IOException e) {
            throw interp.runtimeError("读取输入失败: " + e.getMessage(), node.getLine(), e);
        }
        if (line == null) {
            throw interp.runtimeError("输入已结束", node.getLine());
        }
        return line;
    }

    // ============ 控制流 ============

    @Override
    public JumpSignal visitIfStmt(IfStmt node, Environment env) {
        PinValue condition = evaluator.evaluate(node.getCondition(), env);
        LOG.fine(() -> "条件结果: " + condition + "，类型: " + condition.getTypeName());
        if (condition.isTruthy()) {
            return executeBody(node.getThenBody(), env);
        }
        return executeBody(node.getElseBody(), env);
    }

    @Override
    public JumpSignal visitLoopStmt(LoopStmt node, Environment env) {
        long count = node.isConditional() ? 0 : resolveCount(node, env);
        long iterations = 0;

        while (iterations < Interpreter.MAX_LOOP_ITERATIONS
                && (node.isConditional() ? checkCondition(node, env) : iterations < count)) {
            iterations++;
            long round = iterations;
            LOG.finer(() -> "执行第 " + round + " 次循环");
            JumpSignal signal = executeBody(node.getBody(), env);
            if (signal != null) {
                LOG.fine(() -> "循环体中返回跳转: " + signal);
                return signal;
            }
        }

        if (iterations >= Interpreter.MAX_LOOP_ITERATIONS
                && (node.isConditional() ? checkCondition(node, env) : iterations < count)) {
            interp.warn("警告: 可能存在无限循环，已执行 " + Interpreter.MAX_LOOP_ITERATIONS + " 次迭代后停止");
        }
        long total = iterations;
        LOG.fine(() -> "循环执行完成，共执行了 " + total + " 次");
        return null;
    }

    /**
     * 循环次数在进入循环时求值一次，小数向零取整
     */
    private long resolveCount(LoopStmt node, Environment env) {
        if (node.getCount() == null) {
            return 0;
        }
        PinValue count = evaluator.evaluate(node.getCount(), env);
        if (!BinaryOps.isNumeric(count)) {
            throw interp.runtimeError("循环次数必须是数字，但得到了 " + count.getTypeName(), node.getLine());
        }
        return count.asLong();
    }

    private boolean checkCondition(LoopStmt node, Environment env) {
        PinValue current = env.get(node.getVariable());
        if (current == null) {
            throw interp.runtimeError("未定义的循环变量: " + node.getVariable(), node.getLine());
        }
        PinValue expected = evaluator.evaluate(node.getCompareValue(), env);
        BinaryExpr.BinaryOp op = node.getCompareOp();
        try {
            return BinaryOps.compare(op, current, expected);
        } catch (PinException e) {
            throw interp.locate(e, node.getLine());
        }
    }

    @Override
    public JumpSignal visitJumpStmt(JumpStmt node, Environment env) {
        if (!node.isCurrentFile()) {
            throw interp.runtimeError("暂不支持跨文件跳转", node.getLine());
        }
        String target;
        switch (node.getTargetKind()) {
            case JumpStmt.KIND_LABEL:
                target = node.getTargetValue();
                break;
            case JumpStmt.KIND_LINE:
                target = JumpTargetTable.lineTarget(node.getTargetValue());
                break;
            case JumpStmt.KIND_INPUT:
                target = JumpTargetTable.inputTarget(node.getTargetValue());
                break;
            default:
                throw interp.runtimeError("未知的跳转类型: " + node.getTargetKind(), node.getLine());
        }
        LOG.fine(() -> "跳转目标名称: " + target);
        return new JumpSignal(target);
    }

    @Override
    public JumpSignal visitLabelStmt(LabelStmt node, Environment env) {
        return null;
    }
}
