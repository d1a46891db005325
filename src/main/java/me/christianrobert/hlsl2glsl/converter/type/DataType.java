package me.christianrobert.hlsl2glsl.converter.type;

/**
 * Built-in numeric data types of the shading languages (scalars, vectors and square matrices).
 *
 * <p>Each constant knows its scalar base type and its dimensions, so vector and matrix types can
 * be compared by "kind" (e.g. {@code int3} and {@code int} are both of the int kind).</p>
 */
public enum DataType {

    // Scalars
    BOOL("bool", "bool", null, 1, 1),
    INT("int", "int", null, 1, 1),
    UINT("uint", "uint", null, 1, 1),
    HALF("half", "float", null, 1, 1),
    FLOAT("float", "float", null, 1, 1),
    DOUBLE("double", "double", null, 1, 1),

    // Vectors
    BOOL2("bool2", "bvec2", BOOL, 2, 1),
    BOOL3("bool3", "bvec3", BOOL, 3, 1),
    BOOL4("bool4", "bvec4", BOOL, 4, 1),
    INT2("int2", "ivec2", INT, 2, 1),
    INT3("int3", "ivec3", INT, 3, 1),
    INT4("int4", "ivec4", INT, 4, 1),
    UINT2("uint2", "uvec2", UINT, 2, 1),
    UINT3("uint3", "uvec3", UINT, 3, 1),
    UINT4("uint4", "uvec4", UINT, 4, 1),
    HALF2("half2", "vec2", HALF, 2, 1),
    HALF3("half3", "vec3", HALF, 3, 1),
    HALF4("half4", "vec4", HALF, 4, 1),
    FLOAT2("float2", "vec2", FLOAT, 2, 1),
    FLOAT3("float3", "vec3", FLOAT, 3, 1),
    FLOAT4("float4", "vec4", FLOAT, 4, 1),
    DOUBLE2("double2", "dvec2", DOUBLE, 2, 1),
    DOUBLE3("double3", "dvec3", DOUBLE, 3, 1),
    DOUBLE4("double4", "dvec4", DOUBLE, 4, 1),

    // Matrices
    FLOAT2X2("float2x2", "mat2", FLOAT, 2, 2),
    FLOAT3X3("float3x3", "mat3", FLOAT, 3, 3),
    FLOAT4X4("float4x4", "mat4", FLOAT, 4, 4);

    private final String hlslKeyword;
    private final String glslKeyword;
    private final DataType baseDataType;
    private final int rows;
    private final int columns;

    DataType(String hlslKeyword, String glslKeyword, DataType baseDataType, int rows, int columns) {
        this.hlslKeyword = hlslKeyword;
        this.glslKeyword = glslKeyword;
        this.baseDataType = baseDataType;
        this.rows = rows;
        this.columns = columns;
    }

    public String getHlslKeyword() {
        return hlslKeyword;
    }

    public String getGlslKeyword() {
        return glslKeyword;
    }

    /**
     * Returns the scalar type of this type (the type itself for scalars).
     */
    public DataType getBaseDataType() {
        return baseDataType != null ? baseDataType : this;
    }

    /**
     * Returns the number of vector components (1 for scalars, row count for matrices).
     */
    public int getVectorSize() {
        return rows;
    }

    public boolean isScalar() {
        return baseDataType == null;
    }

    public boolean isVector() {
        return baseDataType != null && columns == 1;
    }

    public boolean isMatrix() {
        return columns > 1;
    }

    /**
     * Checks if this is {@code int} or an {@code int} vector.
     */
    public boolean isIntKind() {
        return getBaseDataType() == INT;
    }

    /**
     * Checks if this is {@code uint} or a {@code uint} vector.
     */
    public boolean isUIntKind() {
        return getBaseDataType() == UINT;
    }

    public boolean isReal() {
        DataType base = getBaseDataType();
        return base == HALF || base == FLOAT || base == DOUBLE;
    }

    /**
     * Checks if both types have the same shape (vector size and column count).
     */
    public boolean hasSameDimensions(DataType other) {
        return other != null && rows == other.rows && columns == other.columns;
    }

    /**
     * Returns the vector type with the given scalar base type and component count.
     *
     * @param base Scalar base type
     * @param size Component count (1 returns the scalar itself)
     * @return Matching vector type
     * @throws IllegalArgumentException if no such vector type exists
     */
    public static DataType toVectorType(DataType base, int size) {
        if (base == null || !base.isScalar()) {
            throw new IllegalArgumentException("Base data type must be a scalar type: " + base);
        }
        if (size == 1) {
            return base;
        }
        for (DataType candidate : values()) {
            if (candidate.baseDataType == base && candidate.isVector() && candidate.rows == size) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("No vector type for " + base + " with " + size + " components");
    }
}
