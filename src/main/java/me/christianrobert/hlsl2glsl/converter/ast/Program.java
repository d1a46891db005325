package me.christianrobert.hlsl2glsl.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the syntax tree: all global statements plus a reference to the entry point.
 */
public class Program extends Node {

    private final List<Stmnt> globalStmnts;
    private FunctionDecl entryPointRef;

    public Program(SourceArea area) {
        super(area);
        this.globalStmnts = new ArrayList<>();
    }

    public List<Stmnt> getGlobalStmnts() {
        return globalStmnts;
    }

    public void addGlobalStmnt(Stmnt stmnt) {
        if (stmnt == null) {
            throw new IllegalArgumentException("Global statement cannot be null");
        }
        globalStmnts.add(stmnt);
    }

    /**
     * Returns the entry point function, or null if upstream analysis found none.
     */
    public FunctionDecl getEntryPointRef() {
        return entryPointRef;
    }

    public void setEntryPointRef(FunctionDecl entryPointRef) {
        this.entryPointRef = entryPointRef;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitProgram(this);
    }
}
