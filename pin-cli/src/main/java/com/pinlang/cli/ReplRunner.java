package com.pinlang.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import pin.runtime.PinLang;
import pin.runtime.PinTrace;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * jline REPL 交互模式：每一行都作为独立的程序运行
 */
public class ReplRunner {

    static final String PROMPT = ">>> ";
    static final String STDIN_FILE_NAME = "<stdin>";

    private final PrintStream out;
    private final PinLang pin;

    public ReplRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.pin = new PinLang().setStdout(out).setStderr(err);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            out.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println("再见！");
    }

    /**
     * jline 主循环；程序中的 shuru 也经同一个 LineReader 读取
     */
    void runLoop(LineReader reader) {
        pin.setStdin(new LineReaderInput(reader));
        while (true) {
            try {
                String line = reader.readLine(PROMPT);
                if (line == null || !handleLine(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        pin.setStdin(reader);
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                out.println("读取输入时出错: " + e.getMessage());
                break;
            }
            if (line == null || !handleLine(line)) break;
        }
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean handleLine(String line) {
        String command = line.trim();
        if ("exit()".equals(command)) {
            return false;
        }
        if ("debug on".equals(command)) {
            PinTrace.setEnabled(true);
            out.println("[调试模式已开启]");
            return true;
        }
        if ("debug off".equals(command)) {
            PinTrace.setEnabled(false);
            out.println("[调试模式已关闭]");
            return true;
        }
        if (command.isEmpty()) {
            return true;
        }
        pin.run(line, STDIN_FILE_NAME);
        return true;
    }

    private void printBanner() {
        out.println(Main.banner() + " - 交互模式");
        out.println("输入 'exit()' 退出");
        out.println("输入 'debug on' 开启调试模式");
        out.println("输入 'debug off' 关闭调试模式");
    }

    /**
     * 把 LineReader 适配成解释器使用的行输入。提示文本已由解释器输出，这里不再重复。
     */
    static final class LineReaderInput extends BufferedReader {

        private final LineReader reader;

        LineReaderInput(LineReader reader) {
            super(Reader.nullReader());
            this.reader = reader;
        }

        /**
         * @return 输入的一行；Ctrl+C 或 Ctrl+D 时返回 null，按输入结束处理
         */
        @Override
        public String readLine() {
            try {
                return reader.readLine();
            } catch (UserInterruptException | EndOfFileException e) {
                return null;
            }
        }
    }
}
