package me.christianrobert.hlsl2glsl.converter.ast;

import java.util.List;

/**
 * Visitor that traverses all owned children in source order and does nothing else.
 *
 * <p>Subclasses override the methods of the node kinds they care about and call the
 * {@code super} method wherever the children should still be visited.</p>
 */
public abstract class DefaultAstVisitor implements AstVisitor {

    /**
     * Visits the node if it is present.
     */
    public void visit(Node ast) {
        if (ast != null) {
            ast.accept(this);
        }
    }

    /**
     * Visits every node of the list. The list is read by index, so a visit may replace
     * the element it is visiting.
     */
    protected void visitAll(List<? extends Node> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            visit(nodes.get(i));
        }
    }

    // ========== Common ==========

    @Override
    public void visitProgram(Program ast) {
        visitAll(ast.getGlobalStmnts());
    }

    @Override
    public void visitCodeBlock(CodeBlock ast) {
        visitAll(ast.getStmnts());
    }

    @Override
    public void visitVarIdent(VarIdent ast) {
        visitAll(ast.getArrayIndices());
        visit(ast.getNext());
    }

    @Override
    public void visitVarType(VarType ast) {
        visit(ast.getStructDecl());
    }

    // ========== Declarations ==========

    @Override
    public void visitVarDecl(VarDecl ast) {
        visitAll(ast.getArrayDims());
        visit(ast.getInitializer());
    }

    @Override
    public void visitStructDecl(StructDecl ast) {
        visitAll(ast.getMembers());
    }

    @Override
    public void visitFunctionDecl(FunctionDecl ast) {
        visit(ast.getReturnType());
        visitAll(ast.getParameters());
        visit(ast.getCodeBlock());
    }

    // ========== Statements ==========

    @Override
    public void visitVarDeclStmnt(VarDeclStmnt ast) {
        visit(ast.getVarType());
        visitAll(ast.getVarDecls());
    }

    @Override
    public void visitStructDeclStmnt(StructDeclStmnt ast) {
        visit(ast.getStructDecl());
    }

    @Override
    public void visitFunctionDeclStmnt(FunctionDeclStmnt ast) {
        visit(ast.getFunctionDecl());
    }

    @Override
    public void visitCodeBlockStmnt(CodeBlockStmnt ast) {
        visit(ast.getCodeBlock());
    }

    @Override
    public void visitForLoopStmnt(ForLoopStmnt ast) {
        visit(ast.getInitStmnt());
        visit(ast.getCondition());
        visit(ast.getIteration());
        visit(ast.getBodyStmnt());
    }

    @Override
    public void visitWhileLoopStmnt(WhileLoopStmnt ast) {
        visit(ast.getCondition());
        visit(ast.getBodyStmnt());
    }

    @Override
    public void visitDoWhileLoopStmnt(DoWhileLoopStmnt ast) {
        visit(ast.getBodyStmnt());
        visit(ast.getCondition());
    }

    @Override
    public void visitIfStmnt(IfStmnt ast) {
        visit(ast.getCondition());
        visit(ast.getBodyStmnt());
        visit(ast.getElseStmnt());
    }

    @Override
    public void visitElseStmnt(ElseStmnt ast) {
        visit(ast.getBodyStmnt());
    }

    @Override
    public void visitExprStmnt(ExprStmnt ast) {
        visit(ast.getExpr());
    }

    @Override
    public void visitReturnStmnt(ReturnStmnt ast) {
        visit(ast.getExpr());
    }

    @Override
    public void visitCtrlTransferStmnt(CtrlTransferStmnt ast) {
        // no children
    }

    // ========== Expressions ==========

    @Override
    public void visitLiteralExpr(LiteralExpr ast) {
        // no children
    }

    @Override
    public void visitBinaryExpr(BinaryExpr ast) {
        visit(ast.getLhsExpr());
        visit(ast.getRhsExpr());
    }

    @Override
    public void visitUnaryExpr(UnaryExpr ast) {
        visit(ast.getExpr());
    }

    @Override
    public void visitTernaryExpr(TernaryExpr ast) {
        visit(ast.getCondExpr());
        visit(ast.getThenExpr());
        visit(ast.getElseExpr());
    }

    @Override
    public void visitBracketExpr(BracketExpr ast) {
        visit(ast.getExpr());
    }

    @Override
    public void visitCastExpr(CastExpr ast) {
        visit(ast.getExpr());
    }

    @Override
    public void visitFunctionCall(FunctionCall ast) {
        visit(ast.getVarIdent());
        visitAll(ast.getArguments());
    }

    @Override
    public void visitVarAccessExpr(VarAccessExpr ast) {
        visit(ast.getVarIdent());
        visit(ast.getAssignExpr());
    }

    @Override
    public void visitListExpr(ListExpr ast) {
        visit(ast.getFirstExpr());
        visit(ast.getNextExpr());
    }
}
