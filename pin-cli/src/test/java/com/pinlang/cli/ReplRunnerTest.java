package com.pinlang.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import pin.runtime.PinTrace;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("REPL")
class ReplRunnerTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ReplRunner repl;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        repl = new ReplRunner(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
    }

    @AfterEach
    void tearDown() {
        PinTrace.setEnabled(false);
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Nested
    @DisplayName("handleLine()")
    class HandleLine {

        @Test
        @DisplayName("exit() 结束循环")
        void exit() {
            assertThat(repl.handleLine("exit()")).isFalse();
            assertThat(repl.handleLine("  exit()  ")).isFalse();
        }

        @Test
        @DisplayName("空行忽略")
        void blankLine() {
            assertThat(repl.handleLine("   ")).isTrue();
            assertThat(stdout()).isEmpty();
        }

        @Test
        @DisplayName("每行作为独立程序运行")
        void eachLineIsProgram() {
            assertThat(repl.handleLine("bl x = 2")).isTrue();
            assertThat(repl.handleLine("dy(x)")).isTrue();
            assertThat(stdout()).isEmpty();
            assertThat(stderr()).isEqualTo("错误，文件 <stdin>，第1行\n错误原因：打印时发生错误: 未定义的变量: x\n");
        }

        @Test
        @DisplayName("同一行内的多条语句共享变量")
        void statementsOnOneLine() {
            repl.handleLine("bl x = 2 jisuan x*3 = y dy(y)");
            assertThat(stdout()).isEqualTo("6\n");
        }

        @Test
        @DisplayName("debug on / debug off 切换跟踪")
        void debugToggle() {
            assertThat(repl.handleLine("debug on")).isTrue();
            assertThat(PinTrace.isEnabled()).isTrue();
            assertThat(repl.handleLine("debug off")).isTrue();
            assertThat(PinTrace.isEnabled()).isFalse();
            assertThat(stdout()).isEqualTo("[调试模式已开启]\n[调试模式已关闭]\n");
        }
    }

    @Nested
    @DisplayName("回退循环")
    class FallbackLoop {

        @Test
        @DisplayName("读到 exit() 停止")
        void stopsAtExit() {
            repl.runFallbackLoop(new BufferedReader(new StringReader("dy(1)\nexit()\ndy(2)\n")));
            assertThat(stdout()).isEqualTo(">>> 1\n>>> ");
        }

        @Test
        @DisplayName("shuru 从同一个 reader 读取回答")
        void inputSharesReader() {
            repl.runFallbackLoop(new BufferedReader(new StringReader(
                    "shuru('名字？') = a dy('你好' + a)\n小明\nexit()\n")));
            assertThat(stdout()).isEqualTo(">>> 名字？你好小明\n>>> ");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("输入结束时停止")
        void stopsAtEndOfInput() {
            repl.runFallbackLoop(new BufferedReader(new StringReader("dy('a')")));
            assertThat(stdout()).isEqualTo(">>> a\n>>> ");
        }
    }

    @Nested
    @DisplayName("jline 循环")
    class JLineLoop {

        @Test
        @DisplayName("shuru 经 LineReader 读取回答")
        void inputThroughLineReader() throws Exception {
            byte[] keys = "shuru('n? ') = a dy('hi ' + a)\nbob\nexit()\n".getBytes(StandardCharsets.US_ASCII);
            try (Terminal terminal = new DumbTerminal(new ByteArrayInputStream(keys), new ByteArrayOutputStream())) {
                LineReader reader = LineReaderBuilder.builder().terminal(terminal).build();
                repl.runLoop(reader);
            }
            assertThat(stdout()).isEqualTo("n? hi bob\n");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("输入耗尽时 shuru 报输入已结束")
        void inputAtEndOfStream() throws Exception {
            byte[] keys = "shuru('n? ') = a\n".getBytes(StandardCharsets.US_ASCII);
            try (Terminal terminal = new DumbTerminal(new ByteArrayInputStream(keys), new ByteArrayOutputStream())) {
                repl.runLoop(LineReaderBuilder.builder().terminal(terminal).build());
            }
            assertThat(stderr()).contains("输入已结束");
        }
    }
}
