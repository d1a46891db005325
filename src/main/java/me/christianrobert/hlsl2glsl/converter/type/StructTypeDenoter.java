package me.christianrobert.hlsl2glsl.converter.type;

import me.christianrobert.hlsl2glsl.converter.ast.StructDecl;

/**
 * Type of a structure instance. Holds a non-owning reference to the structure declaration.
 */
public class StructTypeDenoter extends TypeDenoter {

    private final StructDecl structDeclRef;

    public StructTypeDenoter(StructDecl structDeclRef) {
        if (structDeclRef == null) {
            throw new IllegalArgumentException("Structure declaration cannot be null");
        }
        this.structDeclRef = structDeclRef;
    }

    public StructDecl getStructDeclRef() {
        return structDeclRef;
    }

    @Override
    public boolean isStruct() {
        return true;
    }

    @Override
    public String toTypeString() {
        return "struct " + structDeclRef.getIdent();
    }
}
