package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Comma separated expression pair {@code first, next}.
 */
public class ListExpr extends Expr {

    private Expr firstExpr;
    private Expr nextExpr;

    public ListExpr(SourceArea area, Expr firstExpr, Expr nextExpr) {
        super(area);
        if (firstExpr == null || nextExpr == null) {
            throw new IllegalArgumentException("List expression elements cannot be null");
        }
        this.firstExpr = firstExpr;
        this.nextExpr = nextExpr;
    }

    public Expr getFirstExpr() {
        return firstExpr;
    }

    public void setFirstExpr(Expr firstExpr) {
        this.firstExpr = firstExpr;
    }

    public Expr getNextExpr() {
        return nextExpr;
    }

    public void setNextExpr(Expr nextExpr) {
        this.nextExpr = nextExpr;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        return firstExpr.findTypeDenoter();
    }

    @Override
    public ListExpr copy() {
        return withTypeOf(new ListExpr(getArea(), firstExpr.copy(), nextExpr.copy()));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitListExpr(this);
    }
}
