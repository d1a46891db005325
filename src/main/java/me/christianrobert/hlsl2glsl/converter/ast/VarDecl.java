package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of a single variable, parameter or structure member.
 *
 * <p>The declared type lives on the enclosing {@link VarDeclStmnt}, which is shared by all
 * variables of one declaration statement ({@code int a, b = 1;}).</p>
 */
public class VarDecl extends Decl {

    private String ident;
    private final List<Expr> arrayDims;
    private Expr initializer;
    private String semantic;
    private VarDeclStmnt declStmntRef;

    private boolean shaderInput;
    private boolean shaderOutput;
    private boolean systemValue;

    public VarDecl(SourceArea area, String ident) {
        super(area);
        if (ident == null || ident.trim().isEmpty()) {
            throw new IllegalArgumentException("Variable identifier cannot be null or empty");
        }
        this.ident = ident;
        this.arrayDims = new ArrayList<>();
    }

    public VarDecl(SourceArea area, String ident, Expr initializer) {
        this(area, ident);
        this.initializer = initializer;
    }

    @Override
    public String getIdent() {
        return ident;
    }

    public void setIdent(String ident) {
        this.ident = ident;
    }

    public List<Expr> getArrayDims() {
        return arrayDims;
    }

    public Expr getInitializer() {
        return initializer;
    }

    public void setInitializer(Expr initializer) {
        this.initializer = initializer;
    }

    /**
     * Returns the semantic name (e.g. {@code SV_Position}, {@code TEXCOORD0}) or null.
     */
    public String getSemantic() {
        return semantic;
    }

    public void setSemantic(String semantic) {
        this.semantic = semantic;
    }

    public VarDeclStmnt getDeclStmntRef() {
        return declStmntRef;
    }

    void setDeclStmntRef(VarDeclStmnt declStmntRef) {
        this.declStmntRef = declStmntRef;
    }

    /**
     * Returns the declared type, taken from the enclosing declaration statement.
     *
     * @throws IllegalStateException if the variable is not part of a declaration statement
     */
    @Override
    public TypeDenoter getTypeDenoter() {
        if (declStmntRef == null) {
            throw new IllegalStateException("Variable '" + ident + "' is not part of a declaration statement");
        }
        return declStmntRef.getVarType().getTypeDenoter();
    }

    // ========== Flags ==========

    /**
     * Checks if the variable is bound to a shader input (entry point parameter or input semantic).
     */
    public boolean isShaderInput() {
        return shaderInput;
    }

    public void setShaderInput(boolean shaderInput) {
        this.shaderInput = shaderInput;
    }

    public boolean isShaderOutput() {
        return shaderOutput;
    }

    public void setShaderOutput(boolean shaderOutput) {
        this.shaderOutput = shaderOutput;
    }

    /**
     * Checks if the variable carries a system value semantic (e.g. {@code SV_VertexID}).
     */
    public boolean isSystemValue() {
        return systemValue;
    }

    public void setSystemValue(boolean systemValue) {
        this.systemValue = systemValue;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitVarDecl(this);
    }

    @Override
    public String toString() {
        return "VarDecl{ident=" + ident + "}";
    }
}
