package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Type cast, printed as constructor call in GLSL ({@code uint(x)}).
 */
public class CastExpr extends Expr {

    private final TypeDenoter castType;
    private Expr expr;

    public CastExpr(SourceArea area, TypeDenoter castType, Expr expr) {
        super(area);
        if (castType == null) {
            throw new IllegalArgumentException("Cast type cannot be null");
        }
        if (expr == null) {
            throw new IllegalArgumentException("Cast operand cannot be null");
        }
        this.castType = castType;
        this.expr = expr;
    }

    public TypeDenoter getCastType() {
        return castType;
    }

    public Expr getExpr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = expr;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        return castType;
    }

    @Override
    public CastExpr copy() {
        return withTypeOf(new CastExpr(getArea(), castType, expr.copy()));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitCastExpr(this);
    }
}
