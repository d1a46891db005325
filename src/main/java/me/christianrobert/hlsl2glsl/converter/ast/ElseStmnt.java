package me.christianrobert.hlsl2glsl.converter.ast;

public class ElseStmnt extends Stmnt {

    private Stmnt bodyStmnt;

    public ElseStmnt(SourceArea area, Stmnt bodyStmnt) {
        super(area);
        if (bodyStmnt == null) {
            throw new IllegalArgumentException("Else body cannot be null");
        }
        this.bodyStmnt = bodyStmnt;
    }

    public Stmnt getBodyStmnt() {
        return bodyStmnt;
    }

    public void setBodyStmnt(Stmnt bodyStmnt) {
        this.bodyStmnt = bodyStmnt;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitElseStmnt(this);
    }
}
