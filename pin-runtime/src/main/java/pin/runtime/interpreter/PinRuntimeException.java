package pin.runtime.interpreter;

import pin.runtime.PinException;

/**
 * 拼语言运行时错误
 */
public class PinRuntimeException extends PinException {

    public PinRuntimeException(String message) {
        super(message);
    }

    public PinRuntimeException(String message, int line, String fileName) {
        super(message, line, fileName);
    }

    public PinRuntimeException(String message, int line, String fileName, Throwable cause) {
        super(message, line, fileName, cause);
    }
}
