package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Base class of all expressions.
 *
 * <p>The resolved type is annotated by the upstream type resolution. Node kinds whose type
 * follows from their structure (literals, casts, brackets, ...) derive it when no annotation is
 * present, which also covers nodes synthesized by the legalization pass.</p>
 */
public abstract class Expr extends Node {

    private TypeDenoter typeDenoter;

    protected Expr(SourceArea area) {
        super(area);
    }

    /**
     * Returns the resolved type denoter of this expression.
     *
     * @throws IllegalStateException if the expression was neither annotated nor can derive its type
     */
    public TypeDenoter getTypeDenoter() {
        TypeDenoter resolved = findTypeDenoter();
        if (resolved == null) {
            throw new IllegalStateException(
                    "Missing type denoter for " + getClass().getSimpleName() + " at " + getArea());
        }
        return resolved;
    }

    /**
     * Returns the annotated or derived type denoter, or null if there is none.
     */
    public TypeDenoter findTypeDenoter() {
        return typeDenoter != null ? typeDenoter : deriveTypeDenoter();
    }

    public void setTypeDenoter(TypeDenoter typeDenoter) {
        this.typeDenoter = typeDenoter;
    }

    /**
     * Derives the type from the node structure, or returns null if it cannot be derived.
     */
    protected TypeDenoter deriveTypeDenoter() {
        return null;
    }

    /**
     * Creates a deep copy of this expression. Symbol references are shared, children are copied.
     */
    public abstract Expr copy();

    protected <T extends Expr> T withTypeOf(T copy) {
        copy.setTypeDenoter(typeDenoter);
        return copy;
    }

    protected static Expr copyOrNull(Expr expr) {
        return expr != null ? expr.copy() : null;
    }
}
