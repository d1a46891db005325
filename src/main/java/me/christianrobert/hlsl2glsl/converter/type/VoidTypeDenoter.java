package me.christianrobert.hlsl2glsl.converter.type;

public class VoidTypeDenoter extends TypeDenoter {

    public static final VoidTypeDenoter INSTANCE = new VoidTypeDenoter();

    private VoidTypeDenoter() {
    }

    @Override
    public boolean isVoid() {
        return true;
    }

    @Override
    public String toTypeString() {
        return "void";
    }
}
