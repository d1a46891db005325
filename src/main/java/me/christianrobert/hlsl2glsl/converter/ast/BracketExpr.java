package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Explicit grouping {@code ( expr )}.
 */
public class BracketExpr extends Expr {

    private Expr expr;

    public BracketExpr(SourceArea area, Expr expr) {
        super(area);
        if (expr == null) {
            throw new IllegalArgumentException("Bracket expression content cannot be null");
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
    protected TypeDenoter deriveTypeDenoter() {
        return expr.findTypeDenoter();
    }

    @Override
    public BracketExpr copy() {
        return withTypeOf(new BracketExpr(getArea(), expr.copy()));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitBracketExpr(this);
    }
}
