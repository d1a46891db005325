package me.christianrobert.hlsl2glsl.converter.ast;

/**
 * Base class of all syntax tree nodes.
 *
 * <p>A node owns its children exclusively: every child is referenced from exactly one slot of
 * exactly one parent. Rules replace a child by overwriting the slot with a new subtree. Symbol
 * references (e.g. {@link VarIdent#getSymbolRef()}) are non-owning and are never traversed.</p>
 */
public abstract class Node {

    private final SourceArea area;

    protected Node(SourceArea area) {
        this.area = area != null ? area : SourceArea.IGNORE;
    }

    public SourceArea getArea() {
        return area;
    }

    /**
     * Dispatches to the visitor method for this node kind.
     */
    public abstract void accept(AstVisitor visitor);
}
