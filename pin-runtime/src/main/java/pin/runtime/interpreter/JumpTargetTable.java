package pin.runtime.interpreter;

import com.pinlang.compiler.ast.stmt.InputStmt;
import com.pinlang.compiler.ast.stmt.LabelStmt;
import com.pinlang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 跳转目标表：目标名 → 顶层语句下标。
 *
 * <p>目标来源有三种：标记名（如 hang_start）、每条顶层语句所在行 {@code line_<行号>}、
 * 第 K 条顶层输入语句 {@code input_<K>}（从 0 开始）。
 * 同一行有多条语句时，后面的覆盖前面的行号目标。</p>
 */
public final class JumpTargetTable {

    private static final Logger LOG = Logger.getLogger(JumpTargetTable.class.getName());

    public static final String LINE_PREFIX = "line_";
    public static final String INPUT_PREFIX = "input_";

    private final Map<String, Integer> targets;

    private JumpTargetTable(Map<String, Integer> targets) {
        this.targets = targets;
    }

    /**
     * 对顶层语句做一次正向扫描建表
     */
    public static JumpTargetTable build(List<Statement> statements) {
        Map<String, Integer> targets = new LinkedHashMap<String, Integer>();
        int inputCount = 0;
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            if (stmt instanceof LabelStmt) {
                targets.put(((LabelStmt) stmt).getName(), i);
            }
            if (stmt instanceof InputStmt) {
                targets.put(inputTarget(inputCount++), i);
            }
            targets.put(lineTarget(stmt.getLine()), i);
        }
        LOG.fine(() -> "预处理完成，共有 " + targets.size() + " 个跳转目标");
        return new JumpTargetTable(targets);
    }

    public static String lineTarget(String line) {
        return LINE_PREFIX + line;
    }

    public static String lineTarget(int line) {
        return LINE_PREFIX + line;
    }

    public static String inputTarget(String ordinal) {
        return INPUT_PREFIX + ordinal;
    }

    public static String inputTarget(int ordinal) {
        return INPUT_PREFIX + ordinal;
    }

    /**
     * 查找目标下标
     *
     * @return 语句下标；目标不存在时返回 null
     */
    public Integer resolve(String name) {
        return targets.get(name);
    }

    public boolean contains(String name) {
        return targets.containsKey(name);
    }

    /** 按登记顺序排列的全部目标名 */
    public Set<String> names() {
        return Collections.unmodifiableSet(targets.keySet());
    }
}
