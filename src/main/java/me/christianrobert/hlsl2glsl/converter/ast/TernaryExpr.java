package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

public class TernaryExpr extends Expr {

    private Expr condExpr;
    private Expr thenExpr;
    private Expr elseExpr;

    public TernaryExpr(SourceArea area, Expr condExpr, Expr thenExpr, Expr elseExpr) {
        super(area);
        if (condExpr == null || thenExpr == null || elseExpr == null) {
            throw new IllegalArgumentException("Ternary expression operands cannot be null");
        }
        this.condExpr = condExpr;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expr getCondExpr() {
        return condExpr;
    }

    public void setCondExpr(Expr condExpr) {
        this.condExpr = condExpr;
    }

    public Expr getThenExpr() {
        return thenExpr;
    }

    public void setThenExpr(Expr thenExpr) {
        this.thenExpr = thenExpr;
    }

    public Expr getElseExpr() {
        return elseExpr;
    }

    public void setElseExpr(Expr elseExpr) {
        this.elseExpr = elseExpr;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        return thenExpr.findTypeDenoter();
    }

    @Override
    public TernaryExpr copy() {
        return withTypeOf(new TernaryExpr(getArea(), condExpr.copy(), thenExpr.copy(), elseExpr.copy()));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitTernaryExpr(this);
    }
}
