package me.christianrobert.hlsl2glsl.converter.glsl;

import me.christianrobert.hlsl2glsl.converter.ast.StructDecl;
import me.christianrobert.hlsl2glsl.converter.context.ShaderTarget;

/**
 * Decides whether instances of a structure have no runtime representation in GLSL for the given
 * target, so member accesses through them must address the member directly.
 *
 * <p>Implementations must be pure functions of their arguments.</p>
 */
@FunctionalInterface
public interface StructResolutionPolicy {

    /**
     * @param shaderTarget Active shader target
     * @param structDecl Structure declaration of the accessed variable
     * @return true if the structure must be flattened
     */
    boolean mustResolveStruct(ShaderTarget shaderTarget, StructDecl structDecl);
}
