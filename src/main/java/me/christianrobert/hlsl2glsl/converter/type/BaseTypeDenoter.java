package me.christianrobert.hlsl2glsl.converter.type;

import java.util.Objects;

/**
 * Scalar, vector or matrix numeric type.
 */
public class BaseTypeDenoter extends TypeDenoter {

    private final DataType dataType;

    public BaseTypeDenoter(DataType dataType) {
        if (dataType == null) {
            throw new IllegalArgumentException("Data type cannot be null");
        }
        this.dataType = dataType;
    }

    public static BaseTypeDenoter of(DataType dataType) {
        return new BaseTypeDenoter(dataType);
    }

    public DataType getDataType() {
        return dataType;
    }

    @Override
    public boolean isBase() {
        return true;
    }

    @Override
    public String toTypeString() {
        return dataType.getHlslKeyword();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return dataType == ((BaseTypeDenoter) o).dataType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType);
    }
}
