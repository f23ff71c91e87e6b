package com.pinlang.compiler.lexer;

/**
 * 拼语言词法单元类型
 */
public enum TokenType {
    // === 关键词 - 语句 ===
    PRINT,              // dayin
    PRINT_SHORT,        // dy
    VAR_DEFINE,         // bianliang
    VAR_DEFINE_SHORT,   // bl
    LIST,               // liebiao
    CALCULATE,          // jisuan
    CONVERT,            // zhuanhuan
    IF,                 // panduan
    ELSE,               // fouze
    INPUT,              // shuru
    JUMP,               // tiao
    LOOP,               // xunhuan

    // === 关键词 - 子句 ===
    CREATE,             // chuangjian
    GET,                // huoqu
    EDIT,               // bianji
    INDEX,              // bianhao
    PASS,               // chuandi
    NUMBER_TYPE,        // shuzi
    STRING_TYPE,        // zifu
    RESTRICT,           // jin
    CURRENT_FILE,       // ciwenjian
    LINE,               // hang
    LOOP_COUNT,         // cishu

    // === 标识符和字面量 ===
    ID,
    INTEGER,
    FLOAT,
    STRING,

    // === 操作符 ===
    EQUALS,             // =
    NOT_EQUALS,         // =!
    PLUS,               // +
    MINUS,              // -
    MULTIPLY,           // *
    DIVIDE,             // /
    GT,                 // >
    GE,                 // >=
    LT,                 // <
    LE,                 // <=

    // === 分隔符 ===
    LPAREN,             // ( 或全角（
    RPAREN,             // ) 或全角）
    LBRACKET,           // [
    RBRACKET,           // ]
    COMMA,              // ,
    COLON,              // :

    EOF;

    /**
     * 是否能开始一条语句（顶层分派、代码块和错误恢复共用的判定）
     */
    public boolean isStatementStart() {
        switch (this) {
            case PRINT:
            case PRINT_SHORT:
            case VAR_DEFINE:
            case VAR_DEFINE_SHORT:
            case LIST:
            case CALCULATE:
            case CONVERT:
            case IF:
            case INPUT:
            case JUMP:
            case LOOP:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case GT:
            case GE:
            case LT:
            case LE:
            case EQUALS:
            case NOT_EQUALS:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为四则运算操作符
     */
    public boolean isArithmeticOp() {
        switch (this) {
            case PLUS:
            case MINUS:
            case MULTIPLY:
            case DIVIDE:
                return true;
            default:
                return false;
        }
    }
}
