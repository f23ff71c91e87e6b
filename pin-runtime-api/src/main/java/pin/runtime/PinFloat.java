package pin.runtime;

import java.math.BigDecimal;

/**
 * 拼语言小数值（双精度）
 */
public final class PinFloat extends PinValue {

    private final double value;

    private PinFloat(double value) {
        this.value = value;
    }

    public static PinFloat of(double value) {
        return new PinFloat(value);
    }

    public double getValue() {
        return value;
    }

    /** 是否没有小数部分 */
    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    @Override
    public String getTypeName() {
        return "小数";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public boolean isFloat() {
        return true;
    }

    @Override
    public long asLong() {
        return (long) value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    /**
     * 小数的显示形式：整值保留 ".0"（8.0），极大或极小的值用 "1e-05" 这样的指数形式。
     */
    @Override
    public String toString() {
        if (Double.isNaN(value)) return "nan";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        if (value == 0.0) return (1.0 / value < 0) ? "-0.0" : "0.0";

        double abs = Math.abs(value);
        if (abs >= 1e-4 && abs < 1e16) {
            String text = Double.toString(value);
            if (text.indexOf('E') < 0) {
                return text;
            }
            String plain = new BigDecimal(text).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        String text = Double.toString(value);
        int e = text.indexOf('E');
        if (e < 0) {
            return text;
        }
        String mantissa = text.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        int exponent = Integer.parseInt(text.substring(e + 1));
        String sign = exponent < 0 ? "-" : "+";
        int absExp = Math.abs(exponent);
        return mantissa + "e" + sign + (absExp < 10 ? "0" + absExp : String.valueOf(absExp));
    }

    @Override
    public boolean equals(PinValue other) {
        if (other == null) return false;
        if (other.isNumber() || other.isBoolean()) {
            return value == other.asDouble();
        }
        return false;
    }

    @Override
    public int hashCode() {
        if (isIntegral()) {
            return Long.hashCode((long) value);
        }
        return Double.hashCode(value);
    }
}
