package pin.runtime;

/**
 * 拼语言字符串值
 */
public final class PinString extends PinValue {

    private static final PinString EMPTY = new PinString("");

    private final String value;

    private PinString(String value) {
        this.value = value;
    }

    public static PinString of(String value) {
        if (value.isEmpty()) {
            return EMPTY;
        }
        return new PinString(value);
    }

    public String getValue() {
        return value;
    }

    /** 字符串重复；次数不大于 0 时得到空串 */
    public PinString repeat(long times) {
        if (times <= 0 || value.isEmpty()) {
            return EMPTY;
        }
        if (times > Integer.MAX_VALUE / value.length()) {
            throw new PinException("字符串重复次数过大: " + times);
        }
        StringBuilder sb = new StringBuilder(value.length() * (int) times);
        for (long i = 0; i < times; i++) {
            sb.append(value);
        }
        return new PinString(sb.toString());
    }

    public PinString concat(PinString other) {
        return of(value + other.value);
    }

    @Override
    public String getTypeName() {
        return "字符串";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public String repr() {
        // 与列表显示保持一致：默认单引号，内容含单引号且不含双引号时改用双引号
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder();
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == quote || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append(quote);
        return sb.toString();
    }

    @Override
    public boolean equals(PinValue other) {
        if (other instanceof PinString) {
            return value.equals(((PinString) other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
