package pin.runtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PinLang 便捷 API")
class PinLangTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private PinLang pin;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        pin = new PinLang()
                .setStdout(new PrintStream(out, true, "UTF-8"))
                .setStderr(new PrintStream(err, true, "UTF-8"))
                .setStdin(new ByteArrayInputStream(new byte[0]));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Nested
    @DisplayName("run()")
    class Run {

        @Test
        @DisplayName("成功运行返回 true")
        void runSuccess() {
            assertThat(pin.run("bl x = 5\njisuan x+3 = y\ndy(y)", "demo.pin")).isTrue();
            assertThat(stdout()).isEqualTo("8\n");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("每次运行使用新的变量表")
        void freshEnvironment() {
            pin.run("bl x = 1", "a.pin");
            assertThat(pin.run("dy(x)", "b.pin")).isFalse();
            assertThat(stderr()).contains("未定义的变量: x");
        }

        @Test
        @DisplayName("null 文件名")
        void nullFileName() {
            assertThat(pin.run("dy('ok')", null)).isTrue();
            assertThat(stdout()).isEqualTo("ok\n");
        }
    }

    @Nested
    @DisplayName("错误报告")
    class Errors {

        @Test
        @DisplayName("运行时错误打印到错误流")
        void runtimeError() {
            assertThat(pin.run("dy('a')\nbl z = 1 / 0\ndy('b')", "calc.pin")).isFalse();
            assertThat(stdout()).isEqualTo("a\n");
            assertThat(stderr()).isEqualTo("错误，文件 calc.pin，第2行\n错误原因：除数不能为零\n");
        }

        @Test
        @DisplayName("类型错误附带修复建议")
        void typeError() {
            assertThat(pin.run("bl s = 'a' + 1", "t.pin")).isFalse();
            assertThat(stderr())
                    .contains("字符串类型不可与整数类型进行加法操作")
                    .contains("建议修复：需要zhuanhuan 变量 shuzi = zifu 或相反");
        }

        @Test
        @DisplayName("语法错误被报告，其余语句照常执行")
        void parseErrorsStillRun() {
            assertThat(pin.run("bl = 1\ndy('仍然执行')", "p.pin")).isFalse();
            assertThat(stderr()).isEqualTo("错误，文件 p.pin，第1行\n错误原因：期望 ID，但得到 EQUALS\n");
            assertThat(stdout()).isEqualTo("仍然执行\n");
        }

        @Test
        @DisplayName("词法错误终止运行")
        void lexError() {
            assertThat(pin.run("dy(1)\ndy(@)", "l.pin")).isFalse();
            assertThat(stdout()).isEmpty();
            assertThat(stderr()).isEqualTo("错误，文件 l.pin，第2行\n错误原因：无法识别的字符: '@'\n");
        }

        @Test
        @DisplayName("连续大量 panduan 嵌套过深时报错而不抛出")
        void deepIfChain() {
            StringBuilder source = new StringBuilder();
            for (int i = 0; i < 100000; i++) {
                source.append("panduan 1 = 1:\n    dy(1)\n");
            }
            assertThat(pin.run(source.toString(), "deep.pin")).isFalse();
            assertThat(stderr()).isEqualTo("错误，文件 deep.pin\n错误原因：" + PinLang.NESTING_TOO_DEEP + "\n");
        }

        @Test
        @DisplayName("括号嵌套过深时报错而不抛出")
        void deepParentheses() {
            StringBuilder source = new StringBuilder("dy(");
            for (int i = 0; i < 100000; i++) {
                source.append('(');
            }
            source.append('1');
            for (int i = 0; i < 100000; i++) {
                source.append(')');
            }
            source.append(')');
            assertThat(pin.run(source.toString(), null)).isFalse();
            assertThat(stderr()).isEqualTo("错误：" + PinLang.NESTING_TOO_DEEP + "\n");
        }

        @Test
        @DisplayName("嵌套过深之后同一实例仍可正常运行")
        void usableAfterDeepNesting() {
            StringBuilder source = new StringBuilder();
            for (int i = 0; i < 100000; i++) {
                source.append("panduan 1:\n");
            }
            assertThat(pin.run(source.toString(), "deep.pin")).isFalse();
            assertThat(pin.run("dy('ok')", "ok.pin")).isTrue();
            assertThat(stdout()).isEqualTo("ok\n");
        }

        @Test
        @DisplayName("警告不算失败")
        void warningIsNotFailure() {
            assertThat(pin.run("bl i = 0\nxunhuan i < 1:\n    jisuan i+0 = i", "w.pin")).isTrue();
            assertThat(stderr()).startsWith("警告: 可能存在无限循环");
        }
    }

    @Test
    @DisplayName("多次运行共用输入缓冲")
    void sharedInput() {
        pin.setStdin(new ByteArrayInputStream("一\n二\n".getBytes(StandardCharsets.UTF_8)));
        assertThat(pin.run("shuru('') = a\ndy(a)", null)).isTrue();
        assertThat(pin.run("shuru('') = b\ndy(b)", null)).isTrue();
        assertThat(stdout()).isEqualTo("一\n二\n");
    }
}
