package me.christianrobert.hlsl2glsl.converter.ast;

public class ForLoopStmnt extends Stmnt {

    private Stmnt initStmnt;
    private Expr condition;
    private Expr iteration;
    private Stmnt bodyStmnt;

    public ForLoopStmnt(SourceArea area, Stmnt initStmnt, Expr condition, Expr iteration, Stmnt bodyStmnt) {
        super(area);
        if (bodyStmnt == null) {
            throw new IllegalArgumentException("Loop body cannot be null");
        }
        this.initStmnt = initStmnt;
        this.condition = condition;
        this.iteration = iteration;
        this.bodyStmnt = bodyStmnt;
    }

    public Stmnt getInitStmnt() {
        return initStmnt;
    }

    public void setInitStmnt(Stmnt initStmnt) {
        this.initStmnt = initStmnt;
    }

    public Expr getCondition() {
        return condition;
    }

    public void setCondition(Expr condition) {
        this.condition = condition;
    }

    public Expr getIteration() {
        return iteration;
    }

    public void setIteration(Expr iteration) {
        this.iteration = iteration;
    }

    public Stmnt getBodyStmnt() {
        return bodyStmnt;
    }

    public void setBodyStmnt(Stmnt bodyStmnt) {
        this.bodyStmnt = bodyStmnt;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitForLoopStmnt(this);
    }
}
