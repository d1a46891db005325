package me.christianrobert.hlsl2glsl.converter.context;

/**
 * Pipeline stage the shader is legalized for.
 */
public enum ShaderTarget {
    UNDEFINED,
    VERTEX,
    TESSELLATION_CONTROL,
    TESSELLATION_EVALUATION,
    GEOMETRY,
    FRAGMENT,
    COMPUTE
}
