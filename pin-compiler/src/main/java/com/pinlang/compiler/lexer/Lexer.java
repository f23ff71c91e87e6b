package com.pinlang.compiler.lexer;

import com.pinlang.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 拼语言词法分析器
 *
 * <p>一次性把整段源码转换为 token 列表，末尾追加一个 EOF。
 * 遇到无法识别的字符或未闭合的字符串时抛出 {@link ParseException}，不做恢复。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 关键词映射表（拼音全拼和缩写）
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 语句
        map.put("dayin", TokenType.PRINT);
        map.put("dy", TokenType.PRINT_SHORT);
        map.put("bianliang", TokenType.VAR_DEFINE);
        map.put("bl", TokenType.VAR_DEFINE_SHORT);
        map.put("liebiao", TokenType.LIST);
        map.put("jisuan", TokenType.CALCULATE);
        map.put("zhuanhuan", TokenType.CONVERT);
        map.put("panduan", TokenType.IF);
        map.put("fouze", TokenType.ELSE);
        map.put("shuru", TokenType.INPUT);
        map.put("tiao", TokenType.JUMP);
        map.put("xunhuan", TokenType.LOOP);

        // 列表子句
        map.put("chuangjian", TokenType.CREATE);
        map.put("huoqu", TokenType.GET);
        map.put("bianji", TokenType.EDIT);
        map.put("bianhao", TokenType.INDEX);
        map.put("chuandi", TokenType.PASS);

        // 类型名
        map.put("shuzi", TokenType.NUMBER_TYPE);
        map.put("zifu", TokenType.STRING_TYPE);

        // 输入、跳转、循环子句
        map.put("jin", TokenType.RESTRICT);
        map.put("ciwenjian", TokenType.CURRENT_FILE);
        map.put("hang", TokenType.LINE);
        map.put("cishu", TokenType.LOOP_COUNT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        LOG.fine(() -> "词法分析完成，共 " + tokens.size() + " 个 token");
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '\n':
                newLine();
                break;

            case '#':
                // 行注释，不消费换行
                while (peek() != '\n' && !isAtEnd()) advance();
                break;

            case '=':
                addToken(match('!') ? TokenType.NOT_EQUALS : TokenType.EQUALS);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.MULTIPLY); break;
            case '/': addToken(TokenType.DIVIDE); break;
            case '(':
            case '（':
                addToken(TokenType.LPAREN);
                break;
            case ')':
            case '）':
                addToken(TokenType.RPAREN);
                break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;

            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isWhitespace(c)) {
                    break;
                }
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("无法识别的字符: '" + c + "'");
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        Token token = new Token(type, lexeme, literal, line, tokenColumn);
        tokens.add(token);
        LOG.finer(() -> "token: " + token);
    }

    private ParseException error(String message) {
        return new ParseException(message, line, fileName);
    }

    // === 复杂 Token 扫描 ===

    /** 单引号或双引号字符串，不处理转义，不能跨行 */
    private void string(char quote) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                throw error("字符串未闭合");
            }
            advance();
        }

        if (isAtEnd()) {
            throw error("字符串未闭合");
        }

        advance(); // 闭合的引号
        addToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分：'.' 后必须紧跟数字
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            addToken(TokenType.FLOAT, Double.parseDouble(source.substring(start, current)));
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("整数超出范围: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.ID;
        addToken(type);
    }
}
