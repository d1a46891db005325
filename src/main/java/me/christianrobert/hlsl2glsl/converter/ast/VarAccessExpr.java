package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Variable access, optionally with assignment ({@code a.b = expr}, {@code i += 1}).
 */
public class VarAccessExpr extends Expr {

    private final VarIdent varIdent;
    private AssignOp assignOp;
    private Expr assignExpr;

    public VarAccessExpr(SourceArea area, VarIdent varIdent) {
        this(area, varIdent, null, null);
    }

    public VarAccessExpr(SourceArea area, VarIdent varIdent, AssignOp assignOp, Expr assignExpr) {
        super(area);
        if (varIdent == null) {
            throw new IllegalArgumentException("Variable identifier cannot be null");
        }
        if ((assignOp == null) != (assignExpr == null)) {
            throw new IllegalArgumentException("Assignment operator and expression must be given together");
        }
        this.varIdent = varIdent;
        this.assignOp = assignOp;
        this.assignExpr = assignExpr;
    }

    public VarIdent getVarIdent() {
        return varIdent;
    }

    public AssignOp getAssignOp() {
        return assignOp;
    }

    public Expr getAssignExpr() {
        return assignExpr;
    }

    public void setAssignExpr(Expr assignExpr) {
        this.assignExpr = assignExpr;
    }

    public boolean isAssignment() {
        return assignExpr != null;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        return varIdent.getTypeDenoter();
    }

    @Override
    public VarAccessExpr copy() {
        return withTypeOf(new VarAccessExpr(getArea(), varIdent.copy(), assignOp, copyOrNull(assignExpr)));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVarAccessExpr(this);
    }
}
