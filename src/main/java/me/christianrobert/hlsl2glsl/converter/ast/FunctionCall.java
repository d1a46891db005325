package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.VoidTypeDenoter;

import java.util.ArrayList;
import java.util.List;

/**
 * Call of a user function or an intrinsic.
 *
 * <p>The callee name is a {@link VarIdent} so method-style calls ({@code tex.Sample(...)}) keep
 * their object prefix. Calls of user functions carry {@link Intrinsic#UNDEFINED} and a reference
 * to the called declaration.</p>
 */
public class FunctionCall extends Expr {

    private final VarIdent varIdent;
    private Intrinsic intrinsic;
    private final List<Expr> arguments;
    private FunctionDecl funcDeclRef;

    public FunctionCall(SourceArea area, VarIdent varIdent, Intrinsic intrinsic) {
        super(area);
        this.varIdent = varIdent;
        this.intrinsic = intrinsic != null ? intrinsic : Intrinsic.UNDEFINED;
        this.arguments = new ArrayList<>();
    }

    public FunctionCall(SourceArea area, VarIdent varIdent, Intrinsic intrinsic, List<Expr> arguments) {
        this(area, varIdent, intrinsic);
        for (Expr argument : arguments) {
            addArgument(argument);
        }
    }

    /**
     * Returns the callee name, or null for intrinsics without explicit name.
     */
    public VarIdent getVarIdent() {
        return varIdent;
    }

    public Intrinsic getIntrinsic() {
        return intrinsic;
    }

    public void setIntrinsic(Intrinsic intrinsic) {
        this.intrinsic = intrinsic != null ? intrinsic : Intrinsic.UNDEFINED;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    public void addArgument(Expr argument) {
        if (argument == null) {
            throw new IllegalArgumentException("Argument cannot be null");
        }
        arguments.add(argument);
    }

    public FunctionDecl getFuncDeclRef() {
        return funcDeclRef;
    }

    public void setFuncDeclRef(FunctionDecl funcDeclRef) {
        this.funcDeclRef = funcDeclRef;
    }

    /**
     * Returns the callee name for diagnostics.
     */
    public String getCalleeName() {
        if (varIdent != null) {
            return varIdent.toString();
        }
        return intrinsic.getHlslName() != null ? intrinsic.getHlslName() : "<anonymous>";
    }

    @Override
    protected TypeDenoter deriveTypeDenoter() {
        if (funcDeclRef != null) {
            return funcDeclRef.getTypeDenoter();
        }
        if (!arguments.isEmpty()) {
            return arguments.get(0).findTypeDenoter();
        }
        return VoidTypeDenoter.INSTANCE;
    }

    @Override
    public FunctionCall copy() {
        FunctionCall copy = new FunctionCall(getArea(), varIdent != null ? varIdent.copy() : null, intrinsic);
        for (Expr argument : arguments) {
            copy.addArgument(argument.copy());
        }
        copy.setFuncDeclRef(funcDeclRef);
        return withTypeOf(copy);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return "FunctionCall{" + getCalleeName() + ", intrinsic=" + intrinsic + ", arguments=" + arguments.size() + "}";
    }
}
