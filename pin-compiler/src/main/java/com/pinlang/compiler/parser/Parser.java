package com.pinlang.compiler.parser;

import com.pinlang.compiler.ast.Program;
import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.stmt.LabelStmt;
import com.pinlang.compiler.ast.stmt.Statement;
import com.pinlang.compiler.lexer.Lexer;
import com.pinlang.compiler.lexer.Token;
import com.pinlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.pinlang.compiler.lexer.TokenType.*;

/**
 * 拼语言语法分析器（递归下降）
 *
 * <p>顶层容错：单条语句出错时记录错误，跳到下一个语句关键字继续解析。
 * 语句位置上不能开始语句的 token 一律静默跳过。</p>
 */
public class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    final String fileName;
    private final List<Token> tokens;
    private int pos;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.current = tokens.get(0);
    }

    /**
     * 便捷构造：先做词法分析
     *
     * @throws ParseException 词法错误
     */
    public Parser(Lexer lexer) {
        this(lexer.scanTokens(), lexer.getFileName());
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (pos < tokens.size() - 1) {
            pos++;
            current = tokens.get(pos);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return pos + 1 < tokens.size() ? tokens.get(pos + 1) : tokens.get(tokens.size() - 1);
    }

    int position() {
        return pos;
    }

    /** 将解析位置移到指定下标 */
    void seek(int index) {
        pos = index;
        current = tokens.get(index);
    }

    List<Token> tokens() {
        return tokens;
    }

    boolean isAtEnd() {
        return current.getType() == EOF;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望当前为指定类型的 token 并消费它
     */
    Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error("期望 " + type + "，但得到 " + current.getType());
    }

    ParseException error(String message) {
        return new ParseException(message, current, fileName);
    }

    SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    SourceLocation location() {
        return location(current);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个程序。
     *
     * <p>语法错误不会中断解析，而是收集在返回结果中；已成功解析的语句照常保留。</p>
     */
    public ParseResult parse() {
        LOG.fine("开始解析程序...");
        List<Statement> statements = new ArrayList<Statement>();
        List<ParseError> errors = new ArrayList<ParseError>();

        while (!isAtEnd()) {
            if (isLabel()) {
                Token label = advance();
                LOG.fine(() -> "发现标记点: " + label.getLexeme());
                statements.add(new LabelStmt(location(label), label.getLexeme()));
                continue;
            }
            if (current.getType().isStatementStart()) {
                int start = pos;
                try {
                    Statement stmt = stmtParser.parseStatement();
                    LOG.fine(() -> "成功解析语句: " + stmt.getClass().getSimpleName());
                    statements.add(stmt);
                } catch (ParseException e) {
                    LOG.fine(() -> "解析语句出错: " + e.getRawMessage());
                    errors.add(new ParseError(e));
                    synchronize(start);
                }
            } else if (check(ELSE)) {
                // 脱离 panduan 的 fouze 当作空操作
                advance();
                match(COLON);
            } else {
                LOG.finer(() -> "跳过非语句开始token: " + current);
                advance();
            }
        }

        LOG.fine(() -> "解析完成，共 " + statements.size() + " 个语句");
        return new ParseResult(new Program(fileName, statements), errors);
    }

    /**
     * 顶层标记：以 hang_ 开头的标识符
     */
    private boolean isLabel() {
        return check(ID) && current.getLexeme().startsWith(LabelStmt.PREFIX);
    }

    /**
     * 错误恢复：跳过 token 直到下一个语句关键字。
     * 出错语句一个 token 都没消费时至少跳过一个，保证前进。
     */
    private void synchronize(int start) {
        if (pos == start) {
            advance();
        }
        while (!isAtEnd() && !current.getType().isStatementStart()) {
            advance();
        }
    }
}
