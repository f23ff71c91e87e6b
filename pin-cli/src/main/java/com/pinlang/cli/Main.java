package com.pinlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import pin.runtime.PinLang;
import pin.runtime.PinTrace;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;

/**
 * 拼语言 CLI 入口点（picocli）
 */
@Command(name = "pin", description = "拼语言解释器：运行 .pin 脚本，不带文件时进入交互模式")
public class Main implements Callable<Integer> {

    static final String DEMO_RESOURCE = "demo/loop_test.pin";

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "显示帮助信息")
    boolean help;

    @Option(names = {"-d", "--debug"}, description = "开启调试模式（输出词法、语法和执行跟踪）")
    boolean debug;

    @Option(names = {"-v", "--version"}, description = "显示版本信息")
    boolean version;

    @Option(names = "--test-loop", description = "运行内置的循环测试脚本（强制开启调试模式）")
    boolean testLoop;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "脚本文件")
    String file;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (debug) {
            PinTrace.setEnabled(true);
        }
        if (debug || version || testLoop) {
            out.println(banner());
            if (debug) {
                out.println("[调试模式已开启]");
            }
        }

        ScriptRunner runner = new ScriptRunner(out, err);
        if (testLoop) {
            PinTrace.setEnabled(true);
            out.println("[正在测试循环功能，已强制开启调试模式]");
            return runner.runResource(DEMO_RESOURCE);
        }
        if (file != null) {
            return runner.runFile(file);
        }
        new ReplRunner(out, err).run();
        return 0;
    }

    static String banner() {
        return "拼语言解释器 v" + PinLang.VERSION;
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，按 native.encoding 输出中文
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main(out, err));
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名，取不到 native.encoding 时用默认编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
