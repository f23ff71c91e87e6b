package com.pinlang.compiler.parser;

import com.pinlang.compiler.lexer.Token;
import pin.runtime.PinException;

/**
 * 容错解析中收集的语法错误
 */
public final class ParseError {
    private final String message;
    private final Token token;
    private final int line;
    private final String fileName;

    public ParseError(ParseException e) {
        this.message = e.getRawMessage();
        this.token = e.getToken();
        this.line = e.getLine();
        this.fileName = e.getFileName();
    }

    /** 错误原因，不含位置 */
    public String getMessage() {
        return message;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    public String getFileName() {
        return fileName;
    }

    /** 面向用户的完整错误文本 */
    @Override
    public String toString() {
        return PinException.format(fileName, line, message);
    }
}
