package me.christianrobert.hlsl2glsl.converter.ast;

public class DoWhileLoopStmnt extends Stmnt {

    private Stmnt bodyStmnt;
    private Expr condition;

    public DoWhileLoopStmnt(SourceArea area, Stmnt bodyStmnt, Expr condition) {
        super(area);
        if (bodyStmnt == null) {
            throw new IllegalArgumentException("Loop body cannot be null");
        }
        if (condition == null) {
            throw new IllegalArgumentException("Loop condition cannot be null");
        }
        this.bodyStmnt = bodyStmnt;
        this.condition = condition;
    }

    public Stmnt getBodyStmnt() {
        return bodyStmnt;
    }

    public void setBodyStmnt(Stmnt bodyStmnt) {
        this.bodyStmnt = bodyStmnt;
    }

    public Expr getCondition() {
        return condition;
    }

    public void setCondition(Expr condition) {
        this.condition = condition;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitDoWhileLoopStmnt(this);
    }
}
