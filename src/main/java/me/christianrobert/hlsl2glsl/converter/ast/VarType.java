package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

/**
 * Type specifier of a variable or function declaration.
 *
 * <p>Holds the resolved type denoter and, for {@code struct S { ... } s;} style declarations,
 * the inline structure declaration it owns.</p>
 */
public class VarType extends Node {

    private final TypeDenoter typeDenoter;
    private final StructDecl structDecl;

    public VarType(SourceArea area, TypeDenoter typeDenoter) {
        this(area, typeDenoter, null);
    }

    public VarType(SourceArea area, TypeDenoter typeDenoter, StructDecl structDecl) {
        super(area);
        if (typeDenoter == null) {
            throw new IllegalArgumentException("Type denoter cannot be null");
        }
        this.typeDenoter = typeDenoter;
        this.structDecl = structDecl;
    }

    public TypeDenoter getTypeDenoter() {
        return typeDenoter;
    }

    public StructDecl getStructDecl() {
        return structDecl;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVarType(this);
    }
}
