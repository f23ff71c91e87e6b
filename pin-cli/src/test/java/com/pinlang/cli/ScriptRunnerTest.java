package com.pinlang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptRunnerTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new ScriptRunner(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private Path writeScript(String name, String content) throws Exception {
        Path script = tempDir.resolve(name);
        Files.write(script, content.getBytes(StandardCharsets.UTF_8));
        return script;
    }

    @Test
    @DisplayName("执行脚本文件")
    void runFile() throws Exception {
        Path script = writeScript("hello.pin", "bl name = '世界'\ndy('你好，' + name)\n");
        assertThat(runner.runFile(script.toString())).isEqualTo(0);
        assertThat(stdout()).isEqualTo("你好，世界\n");
        assertThat(stderr()).isEmpty();
    }

    @Test
    @DisplayName("错误信息使用文件的基本名")
    void errorUsesBaseName() throws Exception {
        Path script = writeScript("bad.pin", "dy(1)\nbl x = y\n");
        assertThat(runner.runFile(script.toString())).isEqualTo(1);
        assertThat(stdout()).isEqualTo("1\n");
        assertThat(stderr()).isEqualTo("错误，文件 bad.pin，第2行\n错误原因：未定义的变量: y\n");
    }

    @Test
    @DisplayName("文件不存在")
    void missingFile() {
        String path = tempDir.resolve("nope.pin").toString();
        assertThat(runner.runFile(path)).isEqualTo(1);
        assertThat(stderr()).isEqualTo("错误：找不到文件 '" + path + "'\n");
        assertThat(stdout()).isEmpty();
    }

    @Test
    @DisplayName("运行内置循环示例")
    void runDemoResource() {
        assertThat(runner.runResource(Main.DEMO_RESOURCE)).isEqualTo(0);
        assertThat(stdout()).isEqualTo("开始循环\n0\n继续循环\n"
                + "开始循环\n1\n继续循环\n"
                + "开始循环\n2\n循环结束\n");
    }

    @Test
    @DisplayName("资源不存在")
    void missingResource() {
        assertThat(runner.runResource("demo/none.pin")).isEqualTo(1);
        assertThat(stderr()).contains("demo/none.pin");
    }
}
