package me.christianrobert.hlsl2glsl.converter.ast;

import java.util.ArrayList;
import java.util.List;

public class CodeBlock extends Node {

    private final List<Stmnt> stmnts;

    public CodeBlock(SourceArea area) {
        super(area);
        this.stmnts = new ArrayList<>();
    }

    public CodeBlock(SourceArea area, List<Stmnt> stmnts) {
        this(area);
        for (Stmnt stmnt : stmnts) {
            addStmnt(stmnt);
        }
    }

    public List<Stmnt> getStmnts() {
        return stmnts;
    }

    public void addStmnt(Stmnt stmnt) {
        if (stmnt == null) {
            throw new IllegalArgumentException("Statement cannot be null");
        }
        stmnts.add(stmnt);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitCodeBlock(this);
    }
}
