package pin.runtime.interpreter;

import com.pinlang.compiler.ast.Program;
import com.pinlang.compiler.ast.stmt.Statement;
import pin.runtime.PinException;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

/**
 * 拼语言解释器。
 *
 * <p>在顶层语句下标上做取指-执行循环：顺序执行时下标加一，
 * 收到 {@link JumpSignal} 时按跳转目标表重新定位。两个软上限
 * （顶层步数和单个循环的迭代次数）触达时只打印警告并停止，不报错。</p>
 *
 * <p>每个实例对应一次运行的状态，不是线程安全的。</p>
 */
public class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    /** 顶层最多执行的语句步数 */
    public static final int MAX_STEPS = 1000;

    /** 单个 xunhuan 最多迭代次数 */
    public static final int MAX_LOOP_ITERATIONS = 10000;

    private final String fileName;
    private final Environment environment = new Environment();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(this);
    private final StatementExecutor executor = new StatementExecutor(this, evaluator);

    private JumpTargetTable jumpTargets;

    /** 标准输出流 */
    private PrintStream stdout = System.out;

    /** 标准错误流（错误和警告） */
    private PrintStream stderr = System.err;

    /** 标准输入 */
    private BufferedReader stdin;

    public Interpreter(String fileName) {
        this.fileName = fileName;
    }

    public PrintStream getStdout() { return stdout; }

    public void setStdout(PrintStream stdout) { this.stdout = stdout; }

    public PrintStream getStderr() { return stderr; }

    public void setStderr(PrintStream stderr) { this.stderr = stderr; }

    /** 输入在首次读取时才包装 System.in */
    public BufferedReader getStdin() {
        if (stdin == null) {
            stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return stdin;
    }

    public void setStdin(BufferedReader stdin) { this.stdin = stdin; }

    public void setStdin(InputStream stdin) {
        this.stdin = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    }

    public String getFileName() {
        return fileName;
    }

    public Environment getEnvironment() {
        return environment;
    }

    /** 最近一次运行使用的跳转目标表；尚未运行时为 null */
    public JumpTargetTable getJumpTargets() {
        return jumpTargets;
    }

    /**
     * 执行程序
     *
     * @throws PinRuntimeException 运行时错误
     * @throws PinTypeException    类型错误
     */
    public void execute(Program program) {
        List<Statement> statements = program.getStatements();
        jumpTargets = JumpTargetTable.build(statements);
        LOG.fine(() -> "解释执行开始，共 " + statements.size() + " 个语句");

        int pc = 0;
        int steps = 0;
        while (pc < statements.size() && steps < MAX_STEPS) {
            steps++;
            Statement stmt = statements.get(pc);
            int index = pc;
            int step = steps;
            LOG.fine(() -> "执行语句 " + (index + 1) + "/" + statements.size() + ": "
                    + stmt.getClass().getSimpleName() + " (迭代 " + step + ")");

            JumpSignal signal = executor.execute(stmt, environment);
            if (signal == null) {
                pc++;
                continue;
            }

            Integer target = jumpTargets.resolve(signal.getTargetName());
            if (target == null) {
                throw runtimeError("找不到跳转目标 '" + signal.getTargetName() + "'，可用目标: "
                        + String.join(", ", jumpTargets.names()), stmt.getLine());
            }
            LOG.fine(() -> "找到跳转目标 '" + signal.getTargetName() + "' -> 语句索引 " + target);
            pc = target;
        }

        if (pc < statements.size()) {
            warn("警告: 可能存在无限循环，已执行 " + MAX_STEPS + " 次迭代后停止");
        }
    }

    // ============ 错误与警告 ============

    void warn(String message) {
        stderr.println(message);
    }

    PinRuntimeException runtimeError(String message, int line) {
        return new PinRuntimeException(message, line, fileName);
    }

    PinRuntimeException runtimeError(String message, int line, Throwable cause) {
        return new PinRuntimeException(message, line, fileName, cause);
    }

    /**
     * 为不带位置的错误补上行号和文件名；已有位置的原样返回
     */
    PinException locate(PinException e, int line) {
        if (e.getLine() > 0) {
            return e;
        }
        if (e instanceof PinTypeException) {
            return new PinTypeException(e.getRawMessage(), line, fileName,
                    ((PinTypeException) e).getFixSuggestion());
        }
        return new PinRuntimeException(e.getRawMessage(), line, fileName, e);
    }
}
