package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.BaseTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Prefix unary expression such as {@code -x}, {@code !b} or {@code ++i}.
 */
public class UnaryExpr extends Expr {

    private final UnaryOp op;
    private Expr expr;

    public UnaryExpr(SourceArea area, UnaryOp op, Expr expr) {
        super(area);
        if (op == null) {
            throw new IllegalArgumentException("Unary operator cannot be null");
        }
        if (expr == null) {
            throw new IllegalArgumentException("Unary operand cannot be null");
        }
        this.op = op;
        this.expr = expr;
    }

    public UnaryOp getOp() {
        return op;
    }

    public Expr getExpr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = expr;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        if (op == UnaryOp.LOGICAL_NOT) {
            return BaseTypeDenoter.of(DataType.BOOL);
        }
        return expr.findTypeDenoter();
    }

    @Override
    public UnaryExpr copy() {
        return withTypeOf(new UnaryExpr(getArea(), op, expr.copy()));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitUnaryExpr(this);
    }
}
