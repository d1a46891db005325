package me.christianrobert.hlsl2glsl.converter.ast;

public enum UnaryOp {
    LOGICAL_NOT("!"),
    NOT("~"),
    NOP("+"),
    NEGATE("-"),
    INC("++"),
    DEC("--");

    private final String spell;

    UnaryOp(String spell) {
        this.spell = spell;
    }

    public String getSpell() {
        return spell;
    }
}
