package pin.runtime.interpreter;

import com.pinlang.compiler.ast.stmt.Statement;
import com.pinlang.compiler.lexer.Lexer;
import com.pinlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JumpTargetTableTest {

    private JumpTargetTable build(String source) {
        List<Statement> statements = new Parser(new Lexer(source, "<test>")).parse().getProgram().getStatements();
        return JumpTargetTable.build(statements);
    }

    @Test
    @DisplayName("每条顶层语句登记所在行")
    void testLineTargets() {
        JumpTargetTable table = build("dy(1)\n\nbl x = 2");
        assertEquals(Integer.valueOf(0), table.resolve("line_1"));
        assertEquals(Integer.valueOf(1), table.resolve("line_3"));
        assertNull(table.resolve("line_2"));
        assertFalse(table.contains("line_2"));
    }

    @Test
    @DisplayName("同一行多条语句时后者覆盖")
    void testSameLineOverwrite() {
        JumpTargetTable table = build("dy(1) dy(2)");
        assertEquals(Integer.valueOf(1), table.resolve("line_1"));
        assertEquals(1, table.names().size());
    }

    @Test
    @DisplayName("输入语句按出现顺序编号")
    void testInputOrdinals() {
        JumpTargetTable table = build("shuru('a') = a\ndy(a)\nshuru('b') = b");
        assertEquals(Integer.valueOf(0), table.resolve(JumpTargetTable.inputTarget(0)));
        assertEquals(Integer.valueOf(2), table.resolve(JumpTargetTable.inputTarget("1")));
        assertNull(table.resolve("input_2"));
    }

    @Test
    @DisplayName("标记与行号都是目标，按登记顺序列出")
    void testNamesInOrder() {
        JumpTargetTable table = build("hang_start\ndy(1)\nshuru('x') = a");
        assertEquals(Arrays.asList("hang_start", "line_1", "line_2", "input_0", "line_3"),
                Arrays.asList(table.names().toArray()));
    }

    @Test
    @DisplayName("代码块内的语句不登记")
    void testNestedStatementsIgnored() {
        JumpTargetTable table = build("panduan 1:\n    shuru('x') = a\n    dy(a)");
        assertEquals(1, table.names().size());
        assertEquals(Integer.valueOf(0), table.resolve("line_1"));
    }

    @Test
    @DisplayName("目标名格式")
    void testTargetNames() {
        assertEquals("line_12", JumpTargetTable.lineTarget(12));
        assertEquals("line_12", JumpTargetTable.lineTarget("12"));
        assertEquals("input_0", JumpTargetTable.inputTarget(0));
    }
}
