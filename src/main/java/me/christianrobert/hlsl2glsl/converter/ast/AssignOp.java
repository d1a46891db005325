package me.christianrobert.hlsl2glsl.converter.ast;

public enum AssignOp {
    SET("="),
    ADD("+="),
    SUB("-="),
    MUL("*="),
    DIV("/="),
    MOD("%="),
    LSHIFT("<<="),
    RSHIFT(">>="),
    OR("|="),
    AND("&="),
    XOR("^=");

    private final String spell;

    AssignOp(String spell) {
        this.spell = spell;
    }

    public String getSpell() {
        return spell;
    }
}
