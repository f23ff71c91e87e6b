package pin.runtime;

/**
 * 拼语言布尔值（只由比较运算产生）
 */
public final class PinBoolean extends PinValue {

    public static final PinBoolean TRUE = new PinBoolean(true);

    public static final PinBoolean FALSE = new PinBoolean(false);

    private final boolean value;

    private PinBoolean(boolean value) {
        this.value = value;
    }

    public static PinBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "布尔";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public boolean isBoolean() {
        return true;
    }

    /** 参与比较时按 1/0 计 */
    @Override
    public long asLong() {
        return value ? 1 : 0;
    }

    @Override
    public double asDouble() {
        return value ? 1.0 : 0.0;
    }

    @Override
    public String toString() {
        return value ? "True" : "False";
    }

    @Override
    public boolean equals(PinValue other) {
        if (other instanceof PinBoolean) {
            return value == ((PinBoolean) other).value;
        }
        if (other != null && other.isNumber()) {
            return asDouble() == other.asDouble();
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(asLong());
    }
}
