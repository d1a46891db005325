package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * A declaration an identifier can resolve to.
 */
public abstract class Decl extends Node {

    protected Decl(SourceArea area) {
        super(area);
    }

    public abstract String getIdent();

    /**
     * Returns the resolved type of the declared entity.
     */
    public abstract TypeDenoter getTypeDenoter();
}
