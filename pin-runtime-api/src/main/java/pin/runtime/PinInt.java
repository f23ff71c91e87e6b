package pin.runtime;

/**
 * 拼语言整数值（64 位）
 */
public final class PinInt extends PinValue {

    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final PinInt[] CACHE = new PinInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new PinInt(CACHE_LOW + i);
        }
    }

    /** 获取 PinInt 实例，优先从缓存取 */
    public static PinInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new PinInt(value);
    }

    private final long value;

    private PinInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "整数";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value != 0;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public boolean isInteger() {
        return true;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(PinValue other) {
        if (other instanceof PinInt) {
            return value == ((PinInt) other).value;
        }
        if (other instanceof PinFloat) {
            return value == other.asDouble();
        }
        if (other instanceof PinBoolean) {
            return value == ((PinBoolean) other).asLong();
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
