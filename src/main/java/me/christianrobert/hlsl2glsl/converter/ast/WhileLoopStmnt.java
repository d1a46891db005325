package me.christianrobert.hlsl2glsl.converter.ast;

public class WhileLoopStmnt extends Stmnt {

    private Expr condition;
    private Stmnt bodyStmnt;

    public WhileLoopStmnt(SourceArea area, Expr condition, Stmnt bodyStmnt) {
        super(area);
        if (condition == null) {
            throw new IllegalArgumentException("Loop condition cannot be null");
        }
        if (bodyStmnt == null) {
            throw new IllegalArgumentException("Loop body cannot be null");
        }
        this.condition = condition;
        this.bodyStmnt = bodyStmnt;
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

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitWhileLoopStmnt(this);
    }
}
