package me.christianrobert.hlsl2glsl.converter.ast;

public class ExprStmnt extends Stmnt {

    private Expr expr;

    public ExprStmnt(SourceArea area, Expr expr) {
        super(area);
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = expr;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitExprStmnt(this);
    }
}
