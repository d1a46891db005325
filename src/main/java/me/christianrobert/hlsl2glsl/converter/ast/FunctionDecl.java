package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

import java.util.ArrayList;
import java.util.List;

/**
 * Function declaration or definition.
 *
 * <p>For the entry point, upstream analysis collects the variables bound to input and output
 * semantics; their identifiers are reserved during legalization.</p>
 */
public class FunctionDecl extends Decl {

    private final VarType returnType;
    private final String ident;
    private final List<VarDeclStmnt> parameters;
    private CodeBlock codeBlock;

    private final List<VarDecl> inputSemantics;
    private final List<VarDecl> outputSemantics;

    private boolean reachable = true;
    private boolean entryPoint;

    public FunctionDecl(SourceArea area, VarType returnType, String ident) {
        super(area);
        if (returnType == null) {
            throw new IllegalArgumentException("Return type cannot be null");
        }
        if (ident == null || ident.trim().isEmpty()) {
            throw new IllegalArgumentException("Function identifier cannot be null or empty");
        }
        this.returnType = returnType;
        this.ident = ident;
        this.parameters = new ArrayList<>();
        this.inputSemantics = new ArrayList<>();
        this.outputSemantics = new ArrayList<>();
    }

    public VarType getReturnType() {
        return returnType;
    }

    @Override
    public String getIdent() {
        return ident;
    }

    public List<VarDeclStmnt> getParameters() {
        return parameters;
    }

    public void addParameter(VarDeclStmnt parameter) {
        if (parameter == null) {
            throw new IllegalArgumentException("Parameter cannot be null");
        }
        parameters.add(parameter);
    }

    /**
     * Returns the function body, or null for a forward declaration.
     */
    public CodeBlock getCodeBlock() {
        return codeBlock;
    }

    public void setCodeBlock(CodeBlock codeBlock) {
        this.codeBlock = codeBlock;
    }

    public boolean isForwardDecl() {
        return codeBlock == null;
    }

    public List<VarDecl> getInputSemantics() {
        return inputSemantics;
    }

    public List<VarDecl> getOutputSemantics() {
        return outputSemantics;
    }

    @Override
    public TypeDenoter getTypeDenoter() {
        return returnType.getTypeDenoter();
    }

    // ========== Flags ==========

    /**
     * Checks if the function is reachable from the entry point. Unreachable functions are
     * not emitted and not legalized.
     */
    public boolean isReachable() {
        return reachable;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public boolean isEntryPoint() {
        return entryPoint;
    }

    public void setEntryPoint(boolean entryPoint) {
        this.entryPoint = entryPoint;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitFunctionDecl(this);
    }

    @Override
    public String toString() {
        return "FunctionDecl{ident=" + ident + ", parameters=" + parameters.size() + "}";
    }
}
