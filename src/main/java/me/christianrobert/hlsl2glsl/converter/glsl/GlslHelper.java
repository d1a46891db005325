package me.christianrobert.hlsl2glsl.converter.glsl;

import me.christianrobert.hlsl2glsl.converter.ast.StructDecl;
import me.christianrobert.hlsl2glsl.converter.context.ShaderTarget;

/**
 * GLSL specific decision helpers.
 */
public final class GlslHelper {

    /**
     * Default structure resolution: the vertex shader input structure and the fragment shader
     * output structure become plain {@code in}/{@code out} variables in GLSL, so they are flattened.
     */
    public static final StructResolutionPolicy DEFAULT_STRUCT_RESOLUTION = GlslHelper::mustResolveStructForTarget;

    private GlslHelper() {
    }

    public static boolean mustResolveStructForTarget(ShaderTarget shaderTarget, StructDecl structDecl) {
        if (structDecl == null) {
            return false;
        }
        return (shaderTarget == ShaderTarget.VERTEX && structDecl.isShaderInput())
                || (shaderTarget == ShaderTarget.FRAGMENT && structDecl.isShaderOutput());
    }
}
