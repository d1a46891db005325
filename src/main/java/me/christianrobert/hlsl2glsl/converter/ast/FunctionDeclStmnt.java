package me.christianrobert.hlsl2glsl.converter.ast;

public class FunctionDeclStmnt extends Stmnt {

    private final FunctionDecl functionDecl;

    public FunctionDeclStmnt(SourceArea area, FunctionDecl functionDecl) {
        super(area);
        if (functionDecl == null) {
            throw new IllegalArgumentException("Function declaration cannot be null");
        }
        this.functionDecl = functionDecl;
    }

    public FunctionDecl getFunctionDecl() {
        return functionDecl;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitFunctionDeclStmnt(this);
    }
}
