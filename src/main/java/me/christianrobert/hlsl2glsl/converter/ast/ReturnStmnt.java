package me.christianrobert.hlsl2glsl.converter.ast;

public class ReturnStmnt extends Stmnt {

    private Expr expr;

    public ReturnStmnt(SourceArea area) {
        this(area, null);
    }

    public ReturnStmnt(SourceArea area, Expr expr) {
        super(area);
        this.expr = expr;
    }

    /**
     * Returns the returned expression, or null for {@code return;}.
     */
    public Expr getExpr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = expr;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitReturnStmnt(this);
    }
}
