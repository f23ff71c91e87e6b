package com.pinlang.compiler.parser;

import com.pinlang.compiler.ast.SourceLocation;
import com.pinlang.compiler.ast.expr.BinaryExpr;
import com.pinlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pinlang.compiler.ast.expr.Expression;
import com.pinlang.compiler.ast.expr.Identifier;
import com.pinlang.compiler.ast.stmt.*;
import com.pinlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.pinlang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    private static final Logger LOG = Logger.getLogger(StmtParser.class.getName());

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 按当前关键字分派到具体语句
     */
    Statement parseStatement() {
        Token token = parser.current;
        LOG.finer(() -> "解析语句，当前token: " + token);
        switch (token.getType()) {
            case PRINT:
            case PRINT_SHORT:
                return parsePrintStmt();
            case VAR_DEFINE:
            case VAR_DEFINE_SHORT:
                return parseVarDeclStmt();
            case LIST:
                return parseListStmt();
            case CALCULATE:
                return parseCalculateStmt();
            case CONVERT:
                return parseConvertStmt();
            case IF:
                return parseIfStmt();
            case INPUT:
                return parseInputStmt();
            case JUMP:
                return parseJumpStmt();
            case LOOP:
                return parseLoopStmt();
            default:
                throw parser.error("未知的语句类型: " + token.getType());
        }
    }

    // ============ 简单语句 ============

    private Statement parsePrintStmt() {
        SourceLocation loc = parser.location(parser.advance());
        if (!parser.match(LPAREN)) {
            throw parser.error("打印语句需要左括号，但得到 " + parser.current.getType());
        }
        Expression value = parser.exprParser.parseExpression();
        if (!parser.match(RPAREN)) {
            throw parser.error("打印语句需要右括号，但得到 " + parser.current.getType());
        }
        return new PrintStmt(loc, value);
    }

    private Statement parseVarDeclStmt() {
        SourceLocation loc = parser.location(parser.advance());
        String name = parser.expect(ID).getLexeme();
        parser.expect(EQUALS);
        return new VarDeclStmt(loc, name, parseValue());
    }

    /**
     * 赋值位置的值：支持 [zhuanhuan] zifu("文本") 和 [zhuanhuan] shuzi(expr) 包装写法
     */
    private Expression parseValue() {
        if (parser.check(CONVERT) && parser.peek().isOneOf(STRING_TYPE, NUMBER_TYPE)) {
            parser.advance();
        }
        if (parser.match(STRING_TYPE)) {
            parser.expect(LPAREN);
            Token text = parser.expect(STRING);
            parser.expect(RPAREN);
            return parser.exprParser.literal(text);
        }
        if (parser.match(NUMBER_TYPE)) {
            parser.expect(LPAREN);
            Expression inner = parser.exprParser.parseExpression();
            parser.expect(RPAREN);
            return inner;
        }
        return parser.exprParser.parseExpression();
    }

    // ============ 列表 ============

    private Statement parseListStmt() {
        switch (parser.peek().getType()) {
            case CREATE:
                return parseListCreateStmt();
            case GET:
                return parseListGetStmt();
            case EDIT:
                return parseListEditStmt();
            default:
                throw parser.error("列表操作后应该是 'chuangjian', 'huoqu' 或 'bianji'");
        }
    }

    private Statement parseListCreateStmt() {
        SourceLocation loc = parser.location(parser.advance());
        parser.expect(CREATE);
        String name = parser.expect(ID).getLexeme();
        parser.expect(EQUALS);
        parser.expect(LBRACKET);

        List<Expression> elements = new ArrayList<Expression>();
        if (!parser.check(RBRACKET)) {
            do {
                elements.add(parser.exprParser.parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACKET);
        return new ListCreateStmt(loc, name, elements);
    }

    private Statement parseListGetStmt() {
        SourceLocation loc = parser.location(parser.advance());
        parser.expect(GET);
        String listName = parser.expect(ID).getLexeme();
        Expression index = parseIndexClause();

        // chuandi bl = target，bl 后的等号可省略
        if (!parser.match(VAR_DEFINE) && !parser.match(VAR_DEFINE_SHORT)) {
            throw parser.error("期望 " + VAR_DEFINE + "，但得到 " + parser.current.getType());
        }
        parser.match(EQUALS);
        String target = parser.expect(ID).getLexeme();
        return new ListGetStmt(loc, listName, index, target);
    }

    private Statement parseListEditStmt() {
        SourceLocation loc = parser.location(parser.advance());
        parser.expect(EDIT);
        String listName = parser.expect(ID).getLexeme();
        Expression index = parseIndexClause();
        return new ListEditStmt(loc, listName, index, parseValue());
    }

    /**
     * bianhao = expr chuandi
     */
    private Expression parseIndexClause() {
        parser.expect(INDEX);
        parser.expect(EQUALS);
        Expression index = parser.exprParser.parseExpression();
        parser.expect(PASS);
        return index;
    }

    // ============ 计算与转换 ============

    /**
     * jisuan 只接受单个操作数或 "操作数 运算符 操作数" 三个 token，
     * 范围是 jisuan 之后到第一个等号之前。
     */
    private Statement parseCalculateStmt() {
        SourceLocation loc = parser.location(parser.advance());
        List<Token> tokens = parser.tokens();
        int start = parser.position();

        int equalsPos = -1;
        for (int i = start; i < tokens.size(); i++) {
            if (tokens.get(i).getType() == EQUALS) {
                equalsPos = i;
                break;
            }
        }
        if (equalsPos < 0) {
            throw parser.error("计算语句需要等号");
        }

        List<Token> operands = tokens.subList(start, equalsPos);
        Expression expression;
        if (operands.size() == 1) {
            expression = calculateOperand(operands.get(0));
        } else if (operands.size() == 3 && operands.get(1).getType().isArithmeticOp()) {
            Token op = operands.get(1);
            expression = new BinaryExpr(parser.location(operands.get(0)),
                    calculateOperand(operands.get(0)),
                    BinaryOp.fromToken(op.getType()),
                    calculateOperand(operands.get(2)));
        } else {
            throw parser.error("暂不支持复杂的计算表达式");
        }

        parser.seek(equalsPos);
        parser.expect(EQUALS);
        if (!parser.check(ID)) {
            throw parser.error("计算语句的结果需要赋值给变量，但得到 " + parser.current.getType());
        }
        String target = parser.advance().getLexeme();
        return new CalculateStmt(loc, expression, target);
    }

    private Expression calculateOperand(Token token) {
        if (token.isOneOf(INTEGER, FLOAT, STRING)) {
            return parser.exprParser.literal(token);
        }
        if (token.is(ID)) {
            return new Identifier(parser.location(token), token.getLexeme());
        }
        throw parser.error("暂不支持复杂的计算表达式");
    }

    private Statement parseConvertStmt() {
        SourceLocation loc = parser.location(parser.advance());
        String source = parser.expect(ID).getLexeme();

        ConvertStmt.TargetType targetType;
        if (parser.match(NUMBER_TYPE)) {
            targetType = ConvertStmt.TargetType.NUMBER;
        } else if (parser.match(STRING_TYPE)) {
            targetType = ConvertStmt.TargetType.STRING;
        } else {
            throw parser.error("无效的类型名: " + parser.current.getLexeme());
        }

        parser.expect(EQUALS);
        String target = parser.expect(ID).getLexeme();
        return new ConvertStmt(loc, source, targetType, target);
    }

    // ============ 控制流 ============

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location(parser.advance());
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(COLON);

        // 主体一直延续到 fouze 或文件结束
        List<Statement> thenBody = new ArrayList<Statement>();
        while (!parser.isAtEnd() && !parser.check(ELSE)) {
            if (parser.current.getType().isStatementStart()) {
                thenBody.add(parseStatement());
            } else {
                parser.advance();
            }
        }

        List<Statement> elseBody = new ArrayList<Statement>();
        if (parser.match(ELSE)) {
            parser.match(COLON);
            while (!parser.isAtEnd()) {
                if (parser.current.getType().isStatementStart()) {
                    elseBody.add(parseStatement());
                } else {
                    parser.advance();
                }
            }
        }
        LOG.fine(() -> "if语句解析完成，主体 " + thenBody.size() + " 个语句，else " + elseBody.size() + " 个语句");
        return new IfStmt(loc, condition, thenBody, elseBody);
    }

    private Statement parseLoopStmt() {
        SourceLocation loc = parser.location(parser.advance());

        String variable = null;
        BinaryOp compareOp = null;
        Expression compareValue = null;
        if (parser.check(ID)) {
            variable = parser.advance().getLexeme();
            if (parser.current.getType().isComparisonOp()) {
                compareOp = BinaryOp.fromToken(parser.advance().getType());
                compareValue = loopOperand("循环条件后需要数字或变量，但得到了 ");
            }
        }

        Expression count = null;
        if (parser.match(LOOP_COUNT)) {
            parser.expect(EQUALS);
            count = loopOperand("循环次数后需要数字或变量，但得到了 ");
        }

        parser.expect(COLON);

        // 循环体：与上一条循环体语句相隔一行以上即视为结束
        List<Statement> body = new ArrayList<Statement>();
        while (!parser.isAtEnd() && !parser.check(ELSE)) {
            if (parser.current.getType().isStatementStart()) {
                if (!body.isEmpty() && parser.current.getLine() > body.get(body.size() - 1).getLine() + 1) {
                    break;
                }
                body.add(parseStatement());
            } else {
                parser.advance();
            }
        }
        LOG.fine(() -> "循环解析完成，共 " + body.size() + " 个语句");
        return new LoopStmt(loc, variable, compareOp, compareValue, count, body);
    }

    private Expression loopOperand(String errorPrefix) {
        if (parser.checkAny(INTEGER, FLOAT)) {
            return parser.exprParser.literal(parser.advance());
        }
        if (parser.check(ID)) {
            Token name = parser.advance();
            return new Identifier(parser.location(name), name.getLexeme());
        }
        throw parser.error(errorPrefix + parser.current.getType());
    }

    // ============ 输入与跳转 ============

    private Statement parseInputStmt() {
        SourceLocation loc = parser.location(parser.advance());
        parser.expect(LPAREN);
        String prompt = (String) parser.expect(STRING).getLiteral();
        parser.expect(RPAREN);
        parser.expect(EQUALS);
        String target = parser.expect(ID).getLexeme();

        String restriction = null;
        if (parser.match(RESTRICT)) {
            parser.expect(LPAREN);
            restriction = parser.expect(STRING_TYPE).getLexeme();
            parser.expect(RPAREN);
        }
        return new InputStmt(loc, prompt, target, restriction);
    }

    private Statement parseJumpStmt() {
        SourceLocation loc = parser.location(parser.advance());

        String fileName = null;
        if (!parser.match(CURRENT_FILE)) {
            fileName = parser.expect(ID).getLexeme();
        }

        String kind;
        if (parser.match(LINE)) {
            kind = JumpStmt.KIND_LINE;
        } else if (parser.match(INPUT)) {
            kind = JumpStmt.KIND_INPUT;
        } else {
            kind = parser.expect(ID).getLexeme();
        }

        parser.expect(EQUALS);
        // 标记名可以是标识符，行号和输入序号是整数
        Token value = parser.check(ID) ? parser.advance() : parser.expect(INTEGER);

        String target = value.getLexeme();
        String file = fileName;
        LOG.fine(() -> "跳转语句解析完成: " + (file != null ? file : "ciwenjian") + ", " + kind + ", " + target);
        return new JumpStmt(loc, fileName, kind, target);
    }
}
