package com.pinlang.cli;

import pin.runtime.PinLang;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 脚本执行器，返回进程退出码
 */
public class ScriptRunner {

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件，错误信息中使用文件的基本名
     */
    public int runFile(String filePath) {
        Path path = Paths.get(filePath);
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.fine(() -> "读取文件失败: " + e);
            err.println("错误：找不到文件 '" + filePath + "'");
            return 1;
        }
        String fileName = path.getFileName().toString();
        LOG.fine(() -> "正在执行文件: " + fileName);
        return run(source, fileName);
    }

    /**
     * 执行 classpath 上的脚本资源
     */
    public int runResource(String resource) {
        String source;
        try (InputStream in = ScriptRunner.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                err.println("错误：找不到文件 '" + resource + "'");
                return 1;
            }
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误：" + e.getMessage());
            return 1;
        }
        String fileName = resource.substring(resource.lastIndexOf('/') + 1);
        return run(source, fileName);
    }

    private int run(String source, String fileName) {
        LOG.fine(() -> "文件内容:\n" + source);
        PinLang pin = new PinLang().setStdout(out).setStderr(err);
        return pin.run(source, fileName) ? 0 : 1;
    }
}
