package pin.runtime.interpreter;

import com.pinlang.compiler.ast.stmt.ConvertStmt.TargetType;
import pin.runtime.*;

/**
 * zhuanhuan 语句和受限输入用到的类型转换
 */
public final class TypeConversions {

    private TypeConversions() {}

    public static PinValue convert(PinValue value, TargetType targetType) {
        if (targetType == TargetType.STRING) {
            return PinString.of(value.asString());
        }
        return toNumber(value);
    }

    /**
     * 转为数字：全数字字符串得整数，"d.d" 形式得小数；
     * 数值先按小数处理，值为整数时再收回整数。
     */
    public static PinValue toNumber(PinValue value) {
        if (value instanceof PinString) {
            String text = ((PinString) value).getValue();
            PinValue number = parseNumber(text);
            if (number == null) {
                throw new PinRuntimeException("无法将字符串 '" + text + "' 转换为数字");
            }
            return number;
        }
        if (!BinaryOps.isNumeric(value)) {
            throw new PinRuntimeException("无法将 " + value + " 转换为数字");
        }
        double d = value.asDouble();
        if (value.isInteger() || value.isBoolean()) {
            return PinInt.of(value.asLong());
        }
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p63) {
            return PinInt.of((long) d);
        }
        return PinFloat.of(d);
    }

    /**
     * 解析数字文本：只含数字得整数，去掉一个小数点后只含数字得小数。
     *
     * @return 不是数字文本时返回 null
     */
    public static PinValue parseNumber(String text) {
        if (isDigits(text)) {
            try {
                return PinInt.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new PinRuntimeException("整数超出范围: " + text);
            }
        }
        int dot = text.indexOf('.');
        if (dot >= 0 && isDigits(text.substring(0, dot) + text.substring(dot + 1))) {
            return PinFloat.of(Double.parseDouble(text));
        }
        return null;
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
