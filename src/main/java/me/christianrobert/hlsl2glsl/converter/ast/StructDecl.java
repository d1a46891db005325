package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.StructTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

import java.util.ArrayList;
import java.util.List;

/**
 * Structure declaration with its member declarations.
 */
public class StructDecl extends Decl {

    private final String ident;
    private final List<VarDeclStmnt> members;

    private boolean shaderInput;
    private boolean shaderOutput;

    public StructDecl(SourceArea area, String ident) {
        super(area);
        this.ident = ident != null ? ident : "";
        this.members = new ArrayList<>();
    }

    @Override
    public String getIdent() {
        return ident;
    }

    public boolean isAnonymous() {
        return ident.isEmpty();
    }

    public List<VarDeclStmnt> getMembers() {
        return members;
    }

    public void addMember(VarDeclStmnt member) {
        if (member == null) {
            throw new IllegalArgumentException("Structure member cannot be null");
        }
        members.add(member);
    }

    /**
     * Finds the member variable with the given identifier.
     *
     * @return Member declaration or null if there is none
     */
    public VarDecl findMember(String memberIdent) {
        for (VarDeclStmnt member : members) {
            for (VarDecl varDecl : member.getVarDecls()) {
                if (varDecl.getIdent().equals(memberIdent)) {
                    return varDecl;
                }
            }
        }
        return null;
    }

    @Override
    public TypeDenoter getTypeDenoter() {
        return new StructTypeDenoter(this);
    }

    // ========== Flags ==========

    /**
     * Checks if the structure is used as entry point input interface.
     */
    public boolean isShaderInput() {
        return shaderInput;
    }

    public void setShaderInput(boolean shaderInput) {
        this.shaderInput = shaderInput;
    }

    /**
     * Checks if the structure is used as entry point output interface.
     */
    public boolean isShaderOutput() {
        return shaderOutput;
    }

    public void setShaderOutput(boolean shaderOutput) {
        this.shaderOutput = shaderOutput;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitStructDecl(this);
    }

    @Override
    public String toString() {
        return "StructDecl{ident=" + ident + ", members=" + members.size() + "}";
    }
}
