package pin.runtime;

import com.pinlang.compiler.lexer.Lexer;
import com.pinlang.compiler.lexer.Token;
import com.pinlang.compiler.parser.ParseError;
import com.pinlang.compiler.parser.ParseResult;
import com.pinlang.compiler.parser.Parser;
import pin.runtime.interpreter.Interpreter;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 拼语言便捷 API：词法分析、语法分析、解释执行一步完成。
 *
 * <pre>
 * PinLang pin = new PinLang().setStdout(out);
 * boolean ok = pin.run("bl x = 5\njisuan x+3 = y\ndy(y)", "demo.pin");
 * </pre>
 *
 * <p>每次 {@link #run} 都使用全新的变量表。错误不会抛出，
 * 而是打印到错误流并返回 false。</p>
 */
public final class PinLang {

    private static final Logger LOG = Logger.getLogger(PinLang.class.getName());

    public static final String VERSION = "1.0";

    static final String NESTING_TOO_DEEP = "嵌套层数过深，请减少 panduan 嵌套或括号层数";

    private PrintStream stdout = System.out;
    private PrintStream stderr = System.err;
    private BufferedReader stdin;

    // ── IO 重定向 ─────────────────────────────────────────

    public PinLang setStdout(PrintStream out) {
        this.stdout = out;
        return this;
    }

    public PinLang setStderr(PrintStream err) {
        this.stderr = err;
        return this;
    }

    /** 同一实例的多次运行共用一个读取缓冲，避免丢失已缓冲的输入行 */
    public PinLang setStdin(InputStream in) {
        return setStdin(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    }

    /**
     * 直接使用调用方的行读取器，与调用方共享缓冲（如 REPL 自己读命令行的 reader）
     */
    public PinLang setStdin(BufferedReader in) {
        this.stdin = in;
        return this;
    }

    // ── 执行代码 ──────────────────────────────────────────

    /**
     * 运行一段源码
     *
     * @param source   源码
     * @param fileName 文件名，用于错误信息；可为 null
     * @return 没有任何错误时为 true
     */
    public boolean run(String source, String fileName) {
        try {
            List<Token> tokens = new Lexer(source, fileName).scanTokens();
            ParseResult parsed = new Parser(tokens, fileName).parse();
            for (ParseError error : parsed.getErrors()) {
                stderr.println(error);
            }

            Interpreter interpreter = new Interpreter(fileName);
            interpreter.setStdout(stdout);
            interpreter.setStderr(stderr);
            if (stdin == null) {
                stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            }
            interpreter.setStdin(stdin);
            interpreter.execute(parsed.getProgram());
            return !parsed.hasErrors();
        } catch (PinException e) {
            LOG.log(Level.FINE, "运行失败", e);
            stderr.println(e.getMessage());
            return false;
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "未知错误", e);
            stderr.println("错误：" + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            return false;
        } catch (StackOverflowError e) {
            // panduan 主体延续到文件末尾，连续的 panduan 会逐层嵌套
            LOG.log(Level.FINE, "嵌套层数过深", e);
            stderr.println(PinException.format(fileName, 0, NESTING_TOO_DEEP));
            return false;
        } finally {
            stdout.flush();
        }
    }
}
