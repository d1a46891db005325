package me.christianrobert.hlsl2glsl.converter.type;

/**
 * Type introduced by a {@code typedef}. Resolves to the aliased type via {@link #get()}.
 */
public class AliasTypeDenoter extends TypeDenoter {

    private final String ident;
    private final TypeDenoter aliasedType;

    public AliasTypeDenoter(String ident, TypeDenoter aliasedType) {
        if (aliasedType == null) {
            throw new IllegalArgumentException("Aliased type cannot be null");
        }
        this.ident = ident;
        this.aliasedType = aliasedType;
    }

    public String getIdent() {
        return ident;
    }

    public TypeDenoter getAliasedType() {
        return aliasedType;
    }

    @Override
    public TypeDenoter get() {
        return aliasedType.get();
    }

    @Override
    public String toTypeString() {
        return ident + " (alias of " + aliasedType.toTypeString() + ")";
    }
}
