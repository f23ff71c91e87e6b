package pin.runtime.interpreter;

import pin.runtime.PinException;

/**
 * 拼语言类型错误，可附带修复建议
 */
public class PinTypeException extends PinException {

    private final String fixSuggestion;

    public PinTypeException(String message) {
        this(message, null);
    }

    public PinTypeException(String message, String fixSuggestion) {
        super(message);
        this.fixSuggestion = fixSuggestion;
    }

    public PinTypeException(String message, int line, String fileName, String fixSuggestion) {
        super(message, line, fileName);
        this.fixSuggestion = fixSuggestion;
    }

    public String getFixSuggestion() {
        return fixSuggestion;
    }

    @Override
    public String getMessage() {
        String text = super.getMessage();
        if (fixSuggestion != null && !fixSuggestion.isEmpty()) {
            text += "\n建议修复：" + fixSuggestion;
        }
        return text;
    }
}
