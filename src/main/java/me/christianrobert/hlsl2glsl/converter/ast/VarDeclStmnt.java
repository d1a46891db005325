package me.christianrobert.hlsl2glsl.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration statement of one or more variables sharing a type ({@code float a, b;}).
 * Also used for function parameters and structure members.
 */
public class VarDeclStmnt extends Stmnt {

    private final VarType varType;
    private final List<VarDecl> varDecls;

    public VarDeclStmnt(SourceArea area, VarType varType) {
        super(area);
        if (varType == null) {
            throw new IllegalArgumentException("Variable type cannot be null");
        }
        this.varType = varType;
        this.varDecls = new ArrayList<>();
    }

    public VarDeclStmnt(SourceArea area, VarType varType, VarDecl... varDecls) {
        this(area, varType);
        for (VarDecl varDecl : varDecls) {
            addVarDecl(varDecl);
        }
    }

    public VarType getVarType() {
        return varType;
    }

    public List<VarDecl> getVarDecls() {
        return varDecls;
    }

    public void addVarDecl(VarDecl varDecl) {
        if (varDecl == null) {
            throw new IllegalArgumentException("Variable declaration cannot be null");
        }
        varDecl.setDeclStmntRef(this);
        varDecls.add(varDecl);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVarDeclStmnt(this);
    }
}
