package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.BaseTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

public class BinaryExpr extends Expr {

    private Expr lhsExpr;
    private final BinaryOp op;
    private Expr rhsExpr;

    public BinaryExpr(SourceArea area, Expr lhsExpr, BinaryOp op, Expr rhsExpr) {
        super(area);
        if (lhsExpr == null || rhsExpr == null) {
            throw new IllegalArgumentException("Binary expression operands cannot be null");
        }
        if (op == null) {
            throw new IllegalArgumentException("Binary operator cannot be null");
        }
        this.lhsExpr = lhsExpr;
        this.op = op;
        this.rhsExpr = rhsExpr;
    }

    public Expr getLhsExpr() {
        return lhsExpr;
    }

    public void setLhsExpr(Expr lhsExpr) {
        this.lhsExpr = lhsExpr;
    }

    public BinaryOp getOp() {
        return op;
    }

    public Expr getRhsExpr() {
        return rhsExpr;
    }

    public void setRhsExpr(Expr rhsExpr) {
        this.rhsExpr = rhsExpr;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        TypeDenoter lhsType = lhsExpr.findTypeDenoter();
        if (lhsType == null) {
            return null;
        }
        if (op.isBooleanResult()) {
            TypeDenoter resolved = lhsType.get();
            int size = resolved.isBase() ? ((BaseTypeDenoter) resolved).getDataType().getVectorSize() : 1;
            return BaseTypeDenoter.of(DataType.toVectorType(DataType.BOOL, size));
        }
        return lhsType;
    }

    @Override
    public BinaryExpr copy() {
        return withTypeOf(new BinaryExpr(getArea(), lhsExpr.copy(), op, rhsExpr.copy()));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitBinaryExpr(this);
    }
}
