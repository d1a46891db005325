package me.christianrobert.hlsl2glsl.converter.ast;

public enum BinaryOp {
    LOGICAL_AND("&&"),
    LOGICAL_OR("||"),
    OR("|"),
    XOR("^"),
    AND("&"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">=");

    private final String spell;

    BinaryOp(String spell) {
        this.spell = spell;
    }

    public String getSpell() {
        return spell;
    }

    /**
     * Checks if the operator yields a boolean result.
     */
    public boolean isBooleanResult() {
        switch (this) {
            case LOGICAL_AND:
            case LOGICAL_OR:
            case EQUAL:
            case NOT_EQUAL:
            case LESS:
            case GREATER:
            case LESS_EQUAL:
            case GREATER_EQUAL:
                return true;
            default:
                return false;
        }
    }
}
