package pin.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * 拼语言运行时值的基类
 *
 * <p>值的种类是封闭的：整数、小数、字符串、列表、布尔。
 * 运算和类型转换按这五种标签穷举分派。</p>
 */
public abstract class PinValue {

    /**
     * 将 Java 值转换为 PinValue
     *
     * @param javaValue Java 对象
     * @return 对应的 PinValue
     */
    public static PinValue fromJava(Object javaValue) {
        if (javaValue instanceof PinValue) {
            return (PinValue) javaValue;
        }
        if (javaValue instanceof Integer || javaValue instanceof Long) {
            return PinInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return PinFloat.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return PinBoolean.of((Boolean) javaValue);
        }
        if (javaValue instanceof String) {
            return PinString.of((String) javaValue);
        }
        if (javaValue instanceof List) {
            List<PinValue> items = new ArrayList<PinValue>();
            for (Object item : (List<?>) javaValue) {
                items.add(fromJava(item));
            }
            return new PinList(items);
        }
        String typeName = javaValue == null ? "null" : javaValue.getClass().getName();
        throw new PinException("无法将 Java 对象转换为拼语言值: " + typeName);
    }

    /**
     * 获取值的类型名称（用于错误消息）
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    /**
     * 转换为布尔值（用于条件判断）
     */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNumber() {
        return false;
    }

    public boolean isInteger() {
        return false;
    }

    public boolean isFloat() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isList() {
        return false;
    }

    public boolean isBoolean() {
        return false;
    }

    public long asLong() {
        throw new PinException("无法将" + getTypeName() + "转换为整数");
    }

    public double asDouble() {
        throw new PinException("无法将" + getTypeName() + "转换为小数");
    }

    public String asString() {
        return toString();
    }

    /**
     * 作为列表元素显示时的文本。字符串带引号，其余与 {@link #toString()} 相同。
     */
    public String repr() {
        return toString();
    }

    /**
     * 相等性比较（"=" 运算符语义）
     */
    public boolean equals(PinValue other) {
        if (other == null) return false;
        if (other == this) return true;
        return toJavaValue().equals(other.toJavaValue());
    }

    @Override
    public int hashCode() {
        return toJavaValue().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PinValue) {
            return equals((PinValue) obj);
        }
        return false;
    }
}
