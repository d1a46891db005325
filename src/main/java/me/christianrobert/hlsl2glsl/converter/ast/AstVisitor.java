package me.christianrobert.hlsl2glsl.converter.ast;

/**
 * Visitor with one method per node kind.
 *
 * <p>Adding a node kind adds a method here, so every visitor must handle it (or inherit the
 * child traversal of {@link DefaultAstVisitor}) before the code compiles again.</p>
 */
public interface AstVisitor {

    // ========== Common ==========

    void visitProgram(Program ast);

    void visitCodeBlock(CodeBlock ast);

    void visitVarIdent(VarIdent ast);

    void visitVarType(VarType ast);

    // ========== Declarations ==========

    void visitVarDecl(VarDecl ast);

    void visitStructDecl(StructDecl ast);

    void visitFunctionDecl(FunctionDecl ast);

    // ========== Statements ==========

    void visitVarDeclStmnt(VarDeclStmnt ast);

    void visitStructDeclStmnt(StructDeclStmnt ast);

    void visitFunctionDeclStmnt(FunctionDeclStmnt ast);

    void visitCodeBlockStmnt(CodeBlockStmnt ast);

    void visitForLoopStmnt(ForLoopStmnt ast);

    void visitWhileLoopStmnt(WhileLoopStmnt ast);

    void visitDoWhileLoopStmnt(DoWhileLoopStmnt ast);

    void visitIfStmnt(IfStmnt ast);

    void visitElseStmnt(ElseStmnt ast);

    void visitExprStmnt(ExprStmnt ast);

    void visitReturnStmnt(ReturnStmnt ast);

    void visitCtrlTransferStmnt(CtrlTransferStmnt ast);

    // ========== Expressions ==========

    void visitLiteralExpr(LiteralExpr ast);

    void visitBinaryExpr(BinaryExpr ast);

    void visitUnaryExpr(UnaryExpr ast);

    void visitTernaryExpr(TernaryExpr ast);

    void visitBracketExpr(BracketExpr ast);

    void visitCastExpr(CastExpr ast);

    void visitFunctionCall(FunctionCall ast);

    void visitVarAccessExpr(VarAccessExpr ast);

    void visitListExpr(ListExpr ast);
}
