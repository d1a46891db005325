package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.BaseTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Literal value, stored in its printed source form (e.g. {@code "1.5h"}, {@code "0x10u"}).
 */
public class LiteralExpr extends Expr {

    private DataType dataType;
    private String value;

    public LiteralExpr(SourceArea area, DataType dataType, String value) {
        super(area);
        if (dataType == null) {
            throw new IllegalArgumentException("Literal data type cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Literal value cannot be null");
        }
        this.dataType = dataType;
        this.value = value;
    }

    public DataType getDataType() {
        return dataType;
    }

    public void setDataType(DataType dataType) {
        this.dataType = dataType;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        return BaseTypeDenoter.of(dataType);
    }

    @Override
    public LiteralExpr copy() {
        return withTypeOf(new LiteralExpr(getArea(), dataType, value));
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitLiteralExpr(this);
    }

    @Override
    public String toString() {
        return "LiteralExpr{" + value + " : " + dataType + "}";
    }
}
