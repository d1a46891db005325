package me.christianrobert.hlsl2glsl.converter.ast;

public enum CtrlTransfer {
    BREAK("break"),
    CONTINUE("continue"),
    DISCARD("discard");

    private final String spell;

    CtrlTransfer(String spell) {
        this.spell = spell;
    }

    public String getSpell() {
        return spell;
    }
}
