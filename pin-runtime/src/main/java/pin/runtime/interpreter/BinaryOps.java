package pin.runtime.interpreter;

import com.pinlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import pin.runtime.*;

import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * 二元运算的统一实现。
 *
 * <p>表达式求值和 xunhuan 的条件判断都经过这里。抛出的异常不带位置信息，
 * 由调用方补上行号。</p>
 */
public final class BinaryOps {

    static final String ADD_FIX_SUGGESTION = "需要zhuanhuan 变量 shuzi = zifu 或相反";

    private BinaryOps() {}

    /**
     * 按运算符分派
     */
    public static PinValue apply(BinaryOp op, PinValue left, PinValue right) {
        switch (op) {
            case ADD: return add(left, right);
            case SUB: return sub(left, right);
            case MUL: return mul(left, right);
            case DIV: return div(left, right);
            case EQ:  return PinBoolean.of(left.equals(right));
            case NE:  return PinBoolean.of(!left.equals(right));
            default:  return PinBoolean.of(compare(op, left, right));
        }
    }

    // ============ 算术 ============

    public static PinValue add(PinValue left, PinValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numericPromote(left, right, Math::addExact, Double::sum);
        }
        if (left instanceof PinString && right instanceof PinString) {
            return ((PinString) left).concat((PinString) right);
        }
        throw new PinTypeException(left.getTypeName() + "类型不可与" + right.getTypeName() + "类型进行加法操作",
                ADD_FIX_SUGGESTION);
    }

    public static PinValue sub(PinValue left, PinValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numericPromote(left, right, Math::subtractExact, (a, b) -> a - b);
        }
        throw new PinTypeException("只有数字可以进行减法操作");
    }

    public static PinValue mul(PinValue left, PinValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numericPromote(left, right, Math::multiplyExact, (a, b) -> a * b);
        }
        if (left instanceof PinString && isIntegral(right)) {
            return ((PinString) left).repeat(right.asLong());
        }
        if (isIntegral(left) && right instanceof PinString) {
            return ((PinString) right).repeat(left.asLong());
        }
        throw new PinTypeException("乘法操作符需要兼容的类型");
    }

    /**
     * 除法结果总是小数
     */
    public static PinValue div(PinValue left, PinValue right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            throw new PinTypeException("只有数字可以进行除法操作");
        }
        if (right.asDouble() == 0.0) {
            throw new PinRuntimeException("除数不能为零");
        }
        return PinFloat.of(left.asDouble() / right.asDouble());
    }

    // ============ 比较 ============

    /**
     * 大小比较：数字与数字（布尔按 1/0）、字符串与字符串、列表与列表逐元素
     *
     * @throws PinTypeException 类型不可比较
     */
    public static boolean compare(BinaryOp op, PinValue left, PinValue right) {
        if (op == BinaryOp.EQ) return left.equals(right);
        if (op == BinaryOp.NE) return !left.equals(right);

        int cmp = compareValues(op, left, right);
        switch (op) {
            case GT: return cmp > 0;
            case LT: return cmp < 0;
            case GE: return cmp >= 0;
            case LE: return cmp <= 0;
            default:
                throw new PinRuntimeException("未支持的操作符: " + op.toSourceString());
        }
    }

    private static int compareValues(BinaryOp op, PinValue left, PinValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            if (left.isFloat() || right.isFloat()) {
                return Double.compare(left.asDouble(), right.asDouble());
            }
            return Long.compare(left.asLong(), right.asLong());
        }
        if (left instanceof PinString && right instanceof PinString) {
            return ((PinString) left).getValue().compareTo(((PinString) right).getValue());
        }
        if (left instanceof PinList && right instanceof PinList) {
            List<PinValue> a = ((PinList) left).getElements();
            List<PinValue> b = ((PinList) right).getElements();
            int n = Math.min(a.size(), b.size());
            for (int i = 0; i < n; i++) {
                if (!a.get(i).equals(b.get(i))) {
                    return compareValues(op, a.get(i), b.get(i));
                }
            }
            return Integer.compare(a.size(), b.size());
        }
        throw new PinTypeException("'" + op.toSourceString() + "' 不支持" + left.getTypeName()
                + "与" + right.getTypeName() + "之间的比较");
    }

    // ============ 数值类型提升 ============

    /** 布尔参与算术和比较时当作 1/0 */
    static boolean isNumeric(PinValue value) {
        return value.isNumber() || value.isBoolean();
    }

    private static boolean isIntegral(PinValue value) {
        return value.isInteger() || value.isBoolean();
    }

    /**
     * 有小数参与时按小数计算，否则按 64 位整数计算（溢出报错）
     */
    static PinValue numericPromote(PinValue left, PinValue right,
                                   LongBinaryOperator longOp,
                                   DoubleBinaryOperator doubleOp) {
        if (left.isFloat() || right.isFloat()) {
            return PinFloat.of(doubleOp.applyAsDouble(left.asDouble(), right.asDouble()));
        }
        try {
            return PinInt.of(longOp.applyAsLong(left.asLong(), right.asLong()));
        } catch (ArithmeticException e) {
            throw new PinRuntimeException("整数运算溢出");
        }
    }
}
