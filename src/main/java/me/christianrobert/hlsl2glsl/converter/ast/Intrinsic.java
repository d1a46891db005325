package me.christianrobert.hlsl2glsl.converter.ast;

/**
 * Catalog of built-in functions recognized by tag rather than by user declaration.
 *
 * <p>{@link #UNDEFINED} marks an ordinary call to a user-declared function.</p>
 */
public enum Intrinsic {

    UNDEFINED(null, null),

    ABS("abs", "abs"),
    CLAMP("clamp", "clamp"),
    COS("cos", "cos"),
    CROSS("cross", "cross"),
    DOT("dot", "dot"),
    FRAC("frac", "fract"),
    LERP("lerp", "mix"),
    MAX("max", "max"),
    MIN("min", "min"),
    MUL("mul", null),
    NORMALIZE("normalize", "normalize"),
    POW("pow", "pow"),
    RSQRT("rsqrt", "inversesqrt"),
    SATURATE("saturate", null),
    SIN("sin", "sin"),
    SINCOS("sincos", null),
    SQRT("sqrt", "sqrt"),
    TEX_SAMPLE("Sample", "texture");

    private final String hlslName;
    private final String glslName;

    Intrinsic(String hlslName, String glslName) {
        this.hlslName = hlslName;
        this.glslName = glslName;
    }

    public String getHlslName() {
        return hlslName;
    }

    /**
     * Returns the GLSL function name, or null if the intrinsic has no direct GLSL counterpart
     * and must be rewritten before emission.
     */
    public String getGlslName() {
        return glslName;
    }

    public boolean isUndefined() {
        return this == UNDEFINED;
    }
}
