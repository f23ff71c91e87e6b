package com.pinlang.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import pin.runtime.PinTrace;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("命令行")
class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private StringWriter usage;
    private CommandLine cmd;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        usage = new StringWriter();
        cmd = new CommandLine(new Main(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8")));
        cmd.setOut(new PrintWriter(usage, true));
        cmd.setErr(new PrintWriter(usage, true));
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

    private String script(String content) throws Exception {
        Path file = tempDir.resolve("main.pin");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    @Test
    @DisplayName("运行脚本文件")
    void runFile() throws Exception {
        assertThat(cmd.execute(script("dy(1 + 1)"))).isEqualTo(0);
        assertThat(stdout()).isEqualTo("2\n");
    }

    @Test
    @DisplayName("脚本出错时退出码为 1")
    void failingScript() throws Exception {
        assertThat(cmd.execute(script("dy(q)"))).isEqualTo(1);
        assertThat(stderr()).contains("错误，文件 main.pin，第1行");
    }

    @Test
    @DisplayName("-v 打印版本后继续运行脚本")
    void versionThenRun() throws Exception {
        assertThat(cmd.execute("-v", script("dy('x')"))).isEqualTo(0);
        assertThat(stdout()).isEqualTo("拼语言解释器 v1.0\nx\n");
    }

    @Test
    @DisplayName("-d 开启调试模式")
    void debugFlag() throws Exception {
        assertThat(cmd.execute("--debug", script("dy(1)"))).isEqualTo(0);
        assertThat(PinTrace.isEnabled()).isTrue();
        assertThat(stdout()).startsWith("拼语言解释器 v1.0\n[调试模式已开启]\n");
    }

    @Test
    @DisplayName("--test-loop 运行内置示例")
    void testLoop() {
        assertThat(cmd.execute("--test-loop")).isEqualTo(0);
        assertThat(PinTrace.isEnabled()).isTrue();
        assertThat(stdout())
                .startsWith("拼语言解释器 v1.0\n[正在测试循环功能，已强制开启调试模式]\n")
                .endsWith("循环结束\n");
    }

    @Test
    @DisplayName("文件不存在")
    void missingFile() {
        assertThat(cmd.execute("does-not-exist.pin")).isEqualTo(1);
        assertThat(stderr()).isEqualTo("错误：找不到文件 'does-not-exist.pin'\n");
    }

    @Test
    @DisplayName("--help 输出用法")
    void help() {
        assertThat(cmd.execute("--help")).isEqualTo(0);
        assertThat(usage.toString()).contains("--test-loop").contains("FILE");
        assertThat(stdout()).isEmpty();
    }

    @Test
    @DisplayName("未知选项返回用法错误")
    void unknownOption() {
        assertThat(cmd.execute("--nope")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(usage.toString()).contains("--nope");
    }
}
