package me.christianrobert.hlsl2glsl.converter.ast;

public class CodeBlockStmnt extends Stmnt {

    private final CodeBlock codeBlock;

    public CodeBlockStmnt(SourceArea area, CodeBlock codeBlock) {
        super(area);
        if (codeBlock == null) {
            throw new IllegalArgumentException("Code block cannot be null");
        }
        this.codeBlock = codeBlock;
    }

    public CodeBlock getCodeBlock() {
        return codeBlock;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitCodeBlockStmnt(this);
    }
}
