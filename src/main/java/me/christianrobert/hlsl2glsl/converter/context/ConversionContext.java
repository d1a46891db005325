package me.christianrobert.hlsl2glsl.converter.context;

import me.christianrobert.hlsl2glsl.converter.ast.VarDecl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable state of one legalization run.
 *
 * <p>Contains:
 * <ul>
 *   <li>Settings: shader target and name mangling prefix</li>
 *   <li>Identifiers reserved by the entry point's semantic variables</li>
 *   <li>Traversal state: structure nesting depth and entry point flag</li>
 * </ul>
 *
 * <p>A context is created per conversion and never shared, so reserved identifiers of one
 * program can not leak into the conversion of another.
 */
public class ConversionContext {

    private final ShaderTarget shaderTarget;
    private final String nameManglingPrefix;

    private final Set<String> reservedIdentifiers;
    private int structDeclDepth;
    private boolean insideEntryPoint;

    /**
     * Creates a fresh context.
     *
     * @param shaderTarget Target pipeline stage
     * @param nameManglingPrefix Prefix for renamed identifiers (may be empty)
     */
    public ConversionContext(ShaderTarget shaderTarget, String nameManglingPrefix) {
        if (shaderTarget == null) {
            throw new IllegalArgumentException("Shader target cannot be null");
        }
        if (nameManglingPrefix == null) {
            throw new IllegalArgumentException("Name mangling prefix cannot be null");
        }
        this.shaderTarget = shaderTarget;
        this.nameManglingPrefix = nameManglingPrefix;
        this.reservedIdentifiers = new LinkedHashSet<>();
    }

    public ShaderTarget getShaderTarget() {
        return shaderTarget;
    }

    public String getNameManglingPrefix() {
        return nameManglingPrefix;
    }

    // ========== Reserved Identifiers ==========

    /**
     * Registers the identifiers of the given variables as reserved.
     */
    public void registerReservedIdentifiers(Collection<VarDecl> varDecls) {
        for (VarDecl varDecl : varDecls) {
            reservedIdentifiers.add(varDecl.getIdent());
        }
    }

    public boolean isReservedIdentifier(String ident) {
        return ident != null && reservedIdentifiers.contains(ident);
    }

    public Set<String> getReservedIdentifiers() {
        return Collections.unmodifiableSet(reservedIdentifiers);
    }

    // ========== Structure Nesting ==========

    public void pushStructDecl() {
        structDeclDepth++;
    }

    public void popStructDecl() {
        if (structDeclDepth == 0) {
            throw new IllegalStateException("Structure declaration depth underflow");
        }
        structDeclDepth--;
    }

    public int getStructDeclDepth() {
        return structDeclDepth;
    }

    public boolean isInsideStructDecl() {
        return structDeclDepth > 0;
    }

    // ========== Entry Point ==========

    public boolean isInsideEntryPoint() {
        return insideEntryPoint;
    }

    public void setInsideEntryPoint(boolean insideEntryPoint) {
        this.insideEntryPoint = insideEntryPoint;
    }

    @Override
    public String toString() {
        return "ConversionContext{target=" + shaderTarget
                + ", prefix='" + nameManglingPrefix + "'"
                + ", reserved=" + reservedIdentifiers
                + ", structDeclDepth=" + structDeclDepth
                + ", insideEntryPoint=" + insideEntryPoint + "}";
    }
}
