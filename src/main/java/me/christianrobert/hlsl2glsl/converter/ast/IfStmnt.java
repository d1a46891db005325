package me.christianrobert.hlsl2glsl.converter.ast;

public class IfStmnt extends Stmnt {

    private Expr condition;
    private Stmnt bodyStmnt;
    private ElseStmnt elseStmnt;

    public IfStmnt(SourceArea area, Expr condition, Stmnt bodyStmnt) {
        this(area, condition, bodyStmnt, null);
    }

    public IfStmnt(SourceArea area, Expr condition, Stmnt bodyStmnt, ElseStmnt elseStmnt) {
        super(area);
        if (condition == null) {
            throw new IllegalArgumentException("If condition cannot be null");
        }
        if (bodyStmnt == null) {
            throw new IllegalArgumentException("If body cannot be null");
        }
        this.condition = condition;
        this.bodyStmnt = bodyStmnt;
        this.elseStmnt = elseStmnt;
    }

    public Expr getCondition() {
        return condition;
    }

    public void setCondition(Expr condition) {
        this.condition = condition;
    }

    public Stmnt getBodyStmnt() {
        return bodyStmnt;
    }

    public void setBodyStmnt(Stmnt bodyStmnt) {
        this.bodyStmnt = bodyStmnt;
    }

    public ElseStmnt getElseStmnt() {
        return elseStmnt;
    }

    public void setElseStmnt(ElseStmnt elseStmnt) {
        this.elseStmnt = elseStmnt;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitIfStmnt(this);
    }
}
