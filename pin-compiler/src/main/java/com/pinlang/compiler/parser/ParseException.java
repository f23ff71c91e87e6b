package com.pinlang.compiler.parser;

import com.pinlang.compiler.lexer.Token;
import pin.runtime.PinException;

/**
 * 语法错误（词法分析和语法分析共用）
 */
public class ParseException extends PinException {
    private final Token token;

    public ParseException(String message, Token token, String fileName) {
        super(message, token != null ? token.getLine() : 0, fileName);
        this.token = token;
    }

    public ParseException(String message, int line, String fileName) {
        super(message, line, fileName);
        this.token = null;
    }

    /** 触发错误的 token；词法错误时为 null */
    public Token getToken() {
        return token;
    }
}
