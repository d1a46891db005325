package me.christianrobert.hlsl2glsl.converter.type;

/**
 * Resolved type of a declaration or expression.
 *
 * <p>Type denoters are attached to the tree by the upstream type resolution and are only read
 * by the legalization pass. Transient forms (e.g. {@link AliasTypeDenoter}) are resolved through
 * by {@link #get()}, so rule code always asks {@code typeDenoter.get().isBase()} and never
 * inspects an alias directly.</p>
 */
public abstract class TypeDenoter {

    /**
     * Returns the effective type denoter, resolving aliases.
     */
    public TypeDenoter get() {
        return this;
    }

    public boolean isVoid() {
        return false;
    }

    public boolean isBase() {
        return false;
    }

    public boolean isStruct() {
        return false;
    }

    public boolean isSampler() {
        return false;
    }

    /**
     * Returns a short type name for diagnostics and tree dumps.
     */
    public abstract String toTypeString();

    @Override
    public String toString() {
        return toTypeString();
    }
}
