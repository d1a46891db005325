package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

import java.util.ArrayList;
import java.util.List;

/**
 * One segment of a member access chain such as {@code a.b[i].c}.
 *
 * <p>Each segment owns its array index expressions and its successor, and optionally refers to
 * the declaration it resolves to. The chain root is owned by the enclosing expression.</p>
 */
public class VarIdent extends Node {

    private String ident;
    private List<Expr> arrayIndices;
    private VarIdent next;
    private Decl symbolRef;

    public VarIdent(SourceArea area, String ident) {
        super(area);
        if (ident == null || ident.trim().isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        this.ident = ident;
        this.arrayIndices = new ArrayList<>();
    }

    public VarIdent(SourceArea area, String ident, Decl symbolRef) {
        this(area, ident);
        this.symbolRef = symbolRef;
    }

    public String getIdent() {
        return ident;
    }

    public void setIdent(String ident) {
        this.ident = ident;
    }

    public List<Expr> getArrayIndices() {
        return arrayIndices;
    }

    public VarIdent getNext() {
        return next;
    }

    public void setNext(VarIdent next) {
        this.next = next;
    }

    public Decl getSymbolRef() {
        return symbolRef;
    }

    public void setSymbolRef(Decl symbolRef) {
        this.symbolRef = symbolRef;
    }

    /**
     * Returns the symbol reference as variable declaration, or null if it refers to something else.
     */
    public VarDecl getVarDeclRef() {
        return symbolRef instanceof VarDecl ? (VarDecl) symbolRef : null;
    }

    /**
     * Removes this segment from the chain: this node takes over the identity of its successor,
     * so whoever owns this node now owns the shortened chain. Does nothing on a terminal segment.
     */
    public void popFront() {
        if (next == null) {
            return;
        }
        VarIdent successor = next;
        this.ident = successor.ident;
        this.arrayIndices = successor.arrayIndices;
        this.symbolRef = successor.symbolRef;
        this.next = successor.next;
    }

    /**
     * Returns the terminal segment of the chain.
     */
    public VarIdent getLastVarIdent() {
        VarIdent last = this;
        while (last.next != null) {
            last = last.next;
        }
        return last;
    }

    /**
     * Returns the type of the whole chain, i.e. the type of the declaration the terminal
     * segment resolves to, or null if it is unresolved.
     */
    public TypeDenoter getTypeDenoter() {
        Decl decl = getLastVarIdent().symbolRef;
        return decl != null ? decl.getTypeDenoter() : null;
    }

    /**
     * Creates a deep copy of the chain. Symbol references are shared.
     */
    public VarIdent copy() {
        VarIdent copy = new VarIdent(getArea(), ident, symbolRef);
        for (Expr index : arrayIndices) {
            copy.arrayIndices.add(index.copy());
        }
        if (next != null) {
            copy.next = next.copy();
        }
        return copy;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVarIdent(this);
    }

    /**
     * Returns the dotted path of the chain, e.g. {@code a.b[].c}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (VarIdent segment = this; segment != null; segment = segment.next) {
            if (segment != this) {
                sb.append('.');
            }
            sb.append(segment.ident);
            for (int i = 0; i < segment.arrayIndices.size(); i++) {
                sb.append("[]");
            }
        }
        return sb.toString();
    }
}
