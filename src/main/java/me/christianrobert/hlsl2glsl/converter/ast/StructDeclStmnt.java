package me.christianrobert.hlsl2glsl.converter.ast;

public class StructDeclStmnt extends Stmnt {

    private final StructDecl structDecl;

    public StructDeclStmnt(SourceArea area, StructDecl structDecl) {
        super(area);
        if (structDecl == null) {
            throw new IllegalArgumentException("Structure declaration cannot be null");
        }
        this.structDecl = structDecl;
    }

    public StructDecl getStructDecl() {
        return structDecl;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitStructDeclStmnt(this);
    }
}
