package com.pinlang.compiler.ast;

import com.pinlang.compiler.ast.expr.*;
import com.pinlang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 语句 ============

    default R visitPrintStmt(PrintStmt node, C ctx) { return null; }

    default R visitVarDeclStmt(VarDeclStmt node, C ctx) { return null; }

    default R visitListCreateStmt(ListCreateStmt node, C ctx) { return null; }

    default R visitListGetStmt(ListGetStmt node, C ctx) { return null; }

    default R visitListEditStmt(ListEditStmt node, C ctx) { return null; }

    default R visitCalculateStmt(CalculateStmt node, C ctx) { return null; }

    default R visitConvertStmt(ConvertStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitLoopStmt(LoopStmt node, C ctx) { return null; }

    default R visitInputStmt(InputStmt node, C ctx) { return null; }

    default R visitJumpStmt(JumpStmt node, C ctx) { return null; }

    default R visitLabelStmt(LabelStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }
}
