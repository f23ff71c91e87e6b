package pin.runtime;

/**
 * 拼语言错误基类。
 *
 * <p>携带可选的文件名和行号；{@link #getMessage()} 输出面向用户的完整错误文本，
 * {@link #getRawMessage()} 只返回错误原因。</p>
 */
public class PinException extends RuntimeException {

    private final String fileName;
    private final int line;

    public PinException(String message) {
        this(message, 0, null);
    }

    public PinException(String message, int line, String fileName) {
        super(message);
        this.line = line;
        this.fileName = fileName;
    }

    public PinException(String message, int line, String fileName, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /** 出错行号，0 表示未知 */
    public int getLine() {
        return line;
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return format(fileName, line, getRawMessage());
    }

    /**
     * 按统一格式拼接错误文本：有位置时为两行，否则为单行
     */
    public static String format(String fileName, int line, String message) {
        StringBuilder location = new StringBuilder();
        if (fileName != null) {
            location.append("文件 ").append(fileName);
        }
        if (line > 0) {
            if (location.length() > 0) {
                location.append("，");
            }
            location.append("第").append(line).append("行");
        }
        if (location.length() > 0) {
            return "错误，" + location + "\n错误原因：" + message;
        }
        return "错误：" + message;
    }
}
