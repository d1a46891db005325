package me.christianrobert.hlsl2glsl.converter.glsl;

import me.christianrobert.hlsl2glsl.converter.ast.BinaryExpr;
import me.christianrobert.hlsl2glsl.converter.ast.DefaultAstVisitor;
import me.christianrobert.hlsl2glsl.converter.ast.DoWhileLoopStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.ElseStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.Expr;
import me.christianrobert.hlsl2glsl.converter.ast.ExprStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.ForLoopStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionCall;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionDecl;
import me.christianrobert.hlsl2glsl.converter.ast.IfStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.Intrinsic;
import me.christianrobert.hlsl2glsl.converter.ast.ListExpr;
import me.christianrobert.hlsl2glsl.converter.ast.LiteralExpr;
import me.christianrobert.hlsl2glsl.converter.ast.Node;
import me.christianrobert.hlsl2glsl.converter.ast.Program;
import me.christianrobert.hlsl2glsl.converter.ast.ReturnStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.Stmnt;
import me.christianrobert.hlsl2glsl.converter.ast.StructDecl;
import me.christianrobert.hlsl2glsl.converter.ast.UnaryExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarAccessExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarDecl;
import me.christianrobert.hlsl2glsl.converter.ast.VarDeclStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.VarIdent;
import me.christianrobert.hlsl2glsl.converter.ast.WhileLoopStmnt;
import me.christianrobert.hlsl2glsl.converter.builder.AstFactory;
import me.christianrobert.hlsl2glsl.converter.context.ConversionContext;
import me.christianrobert.hlsl2glsl.converter.context.ConversionException;
import me.christianrobert.hlsl2glsl.converter.type.BaseTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import me.christianrobert.hlsl2glsl.converter.type.StructTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Single mutating traversal that legalizes an HLSL tree for GLSL emission.
 *
 * <p>One instance is created per conversion by {@link GlslConverter} and owns the
 * {@link ConversionContext} of that run.</p>
 */
class GlslConverterVisitor extends DefaultAstVisitor {

    private static final Logger log = LoggerFactory.getLogger(GlslConverterVisitor.class);

    private final ConversionContext context;
    private final StructResolutionPolicy structResolutionPolicy;

    // Declarations renamed in this run, so identifiers referring to them follow the new name
    private final Set<VarDecl> renamedVarDecls = Collections.newSetFromMap(new IdentityHashMap<>());

    GlslConverterVisitor(ConversionContext context, StructResolutionPolicy structResolutionPolicy) {
        this.context = context;
        this.structResolutionPolicy = structResolutionPolicy;
    }

    // ========== Program ==========

    @Override
    public void visitProgram(Program ast) {
        FunctionDecl entryPoint = ast.getEntryPointRef();
        if (entryPoint != null) {
            context.registerReservedIdentifiers(entryPoint.getInputSemantics());
            context.registerReservedIdentifiers(entryPoint.getOutputSemantics());
            log.debug("Reserved identifiers of entry point '{}': {}",
                    entryPoint.getIdent(), context.getReservedIdentifiers());
        } else {
            log.debug("Program has no entry point, no identifiers reserved");
        }

        super.visitProgram(ast);
    }

    // ========== Intrinsics and Calls ==========

    @Override
    public void visitFunctionCall(FunctionCall ast) {
        if (ast.getIntrinsic() == Intrinsic.SATURATE) {
            convertSaturate(ast);
        } else if (ast.getIntrinsic() == Intrinsic.UNDEFINED) {
            // GLSL has no sampler state objects
            boolean removed = ast.getArguments().removeIf(this::exprContainsSampler);
            if (removed) {
                log.debug("Removed sampler arguments from call of '{}' at {}", ast.getCalleeName(), ast.getArea());
            }
        }

        super.visitFunctionCall(ast);
    }

    /**
     * Converts {@code saturate(x)} to {@code clamp(x, T(0), T(1))}.
     */
    private void convertSaturate(FunctionCall ast) {
        if (ast.getArguments().size() != 1) {
            throw runtimeErr("invalid number of arguments in intrinsic 'saturate'", ast);
        }

        Expr arg = ast.getArguments().get(0);
        TypeDenoter argTypeDen = arg.getTypeDenoter().get();
        if (!argTypeDen.isBase()) {
            throw runtimeErr("invalid argument type denoter in intrinsic 'saturate'", arg);
        }

        ast.setIntrinsic(Intrinsic.CLAMP);
        ast.addArgument(AstFactory.makeLiteralCastExpr(argTypeDen, DataType.INT, "0", ast.getArea()));
        ast.addArgument(AstFactory.makeLiteralCastExpr(argTypeDen, DataType.INT, "1", ast.getArea()));
        log.debug("Converted 'saturate' to 'clamp' with type {} at {}", argTypeDen, ast.getArea());
    }

    @Override
    public void visitExprStmnt(ExprStmnt ast) {
        FunctionCall funcCall = AstFactory.findSingleFunctionCall(ast.getExpr());
        if (funcCall != null && funcCall.getIntrinsic() == Intrinsic.SINCOS) {
            ListExpr separated = AstFactory.makeSeparatedSinCosFunctionCalls(funcCall);
            if (separated != null) {
                ast.setExpr(separated);
                log.debug("Split 'sincos' into separate 'sin' and 'cos' calls at {}", ast.getArea());
            }
        }

        super.visitExprStmnt(ast);
    }

    @Override
    public void visitLiteralExpr(LiteralExpr ast) {
        // GLSL has no half precision literal suffix
        String value = ast.getValue();
        if (!value.isEmpty()) {
            char suffix = value.charAt(value.length() - 1);
            if (suffix == 'h' || suffix == 'H') {
                ast.setValue(value.substring(0, value.length() - 1) + "f");
                ast.setDataType(DataType.FLOAT);
            }
        }

        super.visitLiteralExpr(ast);
    }

    // ========== Declarations ==========

    @Override
    public void visitStructDecl(StructDecl ast) {
        context.pushStructDecl();
        try {
            super.visitStructDecl(ast);
        } finally {
            context.popStructDecl();
        }
    }

    @Override
    public void visitVarDecl(VarDecl ast) {
        if (mustRenameVarDecl(ast)) {
            renameVarDecl(ast);
        }

        if (ast.getInitializer() != null) {
            ast.setInitializer(convertExprIfCastRequired(ast.getInitializer(), ast.getTypeDenoter()));
        }

        super.visitVarDecl(ast);
    }

    @Override
    public void visitFunctionDecl(FunctionDecl ast) {
        if (!ast.isReachable()) {
            log.trace("Skipping unreachable function '{}'", ast.getIdent());
            return;
        }

        // GLSL has no sampler state objects
        boolean removed = ast.getParameters().removeIf(this::varTypeIsSampler);
        if (removed) {
            log.debug("Removed sampler parameters from function '{}'", ast.getIdent());
        }

        if (ast.isEntryPoint()) {
            context.setInsideEntryPoint(true);
            try {
                super.visitFunctionDecl(ast);
            } finally {
                context.setInsideEntryPoint(false);
            }
        } else {
            super.visitFunctionDecl(ast);
        }
    }

    // ========== Statements ==========

    @Override
    public void visitForLoopStmnt(ForLoopStmnt ast) {
        ast.setBodyStmnt(makeCodeBlockInEntryPointReturnStmnt(ast.getBodyStmnt()));
        super.visitForLoopStmnt(ast);
    }

    @Override
    public void visitWhileLoopStmnt(WhileLoopStmnt ast) {
        ast.setBodyStmnt(makeCodeBlockInEntryPointReturnStmnt(ast.getBodyStmnt()));
        super.visitWhileLoopStmnt(ast);
    }

    @Override
    public void visitDoWhileLoopStmnt(DoWhileLoopStmnt ast) {
        ast.setBodyStmnt(makeCodeBlockInEntryPointReturnStmnt(ast.getBodyStmnt()));
        super.visitDoWhileLoopStmnt(ast);
    }

    @Override
    public void visitIfStmnt(IfStmnt ast) {
        ast.setBodyStmnt(makeCodeBlockInEntryPointReturnStmnt(ast.getBodyStmnt()));
        super.visitIfStmnt(ast);
    }

    @Override
    public void visitElseStmnt(ElseStmnt ast) {
        ast.setBodyStmnt(makeCodeBlockInEntryPointReturnStmnt(ast.getBodyStmnt()));
        super.visitElseStmnt(ast);
    }

    // ========== Expressions ==========

    @Override
    public void visitBinaryExpr(BinaryExpr ast) {
        super.visitBinaryExpr(ast);

        ast.setRhsExpr(convertExprIfCastRequired(ast.getRhsExpr(), ast.getLhsExpr().getTypeDenoter()));
    }

    @Override
    public void visitUnaryExpr(UnaryExpr ast) {
        // "- -x" must not be printed as "--x"
        if (ast.getExpr() instanceof UnaryExpr) {
            ast.setExpr(AstFactory.makeBracketExpr(ast.getExpr(), ast.getArea()));
        }

        super.visitUnaryExpr(ast);
    }

    @Override
    public void visitVarAccessExpr(VarAccessExpr ast) {
        super.visitVarAccessExpr(ast);

        if (ast.getAssignExpr() != null) {
            ast.setAssignExpr(convertExprIfCastRequired(ast.getAssignExpr(), ast.getTypeDenoter()));
        }
    }

    @Override
    public void visitVarIdent(VarIdent ast) {
        if (ast.getNext() != null) {
            StructDecl structDecl = getStructDeclOfVarIdent(ast);
            if (structDecl != null) {
                if (mustResolveStruct(structDecl)) {
                    log.debug("Flattening access '{}' through structure '{}'", ast, structDecl.getIdent());
                    ast.popFront();
                } else {
                    makeVarIdentWithSystemSemanticLocal(ast);
                }
            }
        }

        // Only the chain root is subject to flattening; index expressions of every segment are still visited
        for (VarIdent segment = ast; segment != null; segment = segment.getNext()) {
            VarDecl varDecl = segment.getVarDeclRef();
            if (varDecl != null && renamedVarDecls.contains(varDecl)) {
                segment.setIdent(varDecl.getIdent());
            }
            visitAll(segment.getArrayIndices());
        }
    }

    // ========== Helpers: Structures and System Values ==========

    /**
     * Returns the structure declaration of the variable the segment refers to, or null if the
     * segment does not refer to a struct-typed variable.
     */
    private StructDecl getStructDeclOfVarIdent(VarIdent ast) {
        VarDecl varDecl = ast.getVarDeclRef();
        if (varDecl == null || varDecl.getDeclStmntRef() == null) {
            return null;
        }
        TypeDenoter varTypeDen = varDecl.getTypeDenoter().get();
        if (varTypeDen instanceof StructTypeDenoter) {
            return ((StructTypeDenoter) varTypeDen).getStructDeclRef();
        }
        return null;
    }

    private boolean mustResolveStruct(StructDecl structDecl) {
        return structResolutionPolicy.mustResolveStruct(context.getShaderTarget(), structDecl);
    }

    private boolean hasVarDeclOfVarIdentSystemSemantic(VarIdent varIdent) {
        VarDecl varDecl = varIdent.getVarDeclRef();
        return varDecl != null && varDecl.isSystemValue();
    }

    /**
     * Strips the leading segments up to the first system value segment, so that segment becomes
     * the chain root and is addressed like a local variable. Leaves the chain unchanged if no
     * segment refers to a system value.
     */
    private void makeVarIdentWithSystemSemanticLocal(VarIdent root) {
        for (VarIdent segment = root; segment != null; segment = segment.getNext()) {
            if (hasVarDeclOfVarIdentSystemSemantic(segment)) {
                String original = root.toString();
                while (!hasVarDeclOfVarIdentSystemSemantic(root)) {
                    root.popFront();
                }
                log.debug("Converted access '{}' to system value access '{}'", original, root);
                return;
            }
        }
    }

    // ========== Helpers: Renaming ==========

    /**
     * A variable is renamed if it is not a structure member, not a shader input, and its name
     * is reserved by an entry point semantic.
     */
    private boolean mustRenameVarDecl(VarDecl ast) {
        return !context.isInsideStructDecl()
                && !ast.isShaderInput()
                && context.isReservedIdentifier(ast.getIdent());
    }

    private void renameVarDecl(VarDecl ast) {
        String newIdent = context.getNameManglingPrefix() + ast.getIdent();
        log.debug("Renaming variable '{}' to '{}' at {}", ast.getIdent(), newIdent, ast.getArea());
        ast.setIdent(newIdent);
        renamedVarDecls.add(ast);
    }

    // ========== Helpers: Samplers ==========

    private boolean exprContainsSampler(Expr expr) {
        return expr.getTypeDenoter().get().isSampler();
    }

    private boolean varTypeIsSampler(VarDeclStmnt param) {
        return param.getVarType().getTypeDenoter().get().isSampler();
    }

    // ========== Helpers: Casts ==========

    /**
     * Returns the data type the source must be cast to, or null if no cast is required.
     * Only int/uint mismatches of equally shaped base types require a cast.
     */
    static DataType mustCastExprToDataType(TypeDenoter targetTypeDen, TypeDenoter sourceTypeDen) {
        TypeDenoter target = targetTypeDen.get();
        TypeDenoter source = sourceTypeDen.get();
        if (!(target instanceof BaseTypeDenoter) || !(source instanceof BaseTypeDenoter)) {
            return null;
        }

        DataType targetType = ((BaseTypeDenoter) target).getDataType();
        DataType sourceType = ((BaseTypeDenoter) source).getDataType();
        if (!targetType.hasSameDimensions(sourceType)) {
            return null;
        }

        if (targetType.isUIntKind() && sourceType.isIntKind()) {
            return targetType;
        }
        if (targetType.isIntKind() && sourceType.isUIntKind()) {
            return targetType;
        }
        return null;
    }

    /**
     * Returns the expression wrapped in a cast to the target type if required, otherwise the
     * expression itself. The caller stores the result back into the slot.
     */
    private Expr convertExprIfCastRequired(Expr expr, TypeDenoter targetTypeDen) {
        DataType dataType = mustCastExprToDataType(targetTypeDen, expr.getTypeDenoter());
        if (dataType == null) {
            return expr;
        }
        log.trace("Inserting cast to '{}' at {}", dataType.getGlslKeyword(), expr.getArea());
        return AstFactory.makeBaseTypeCastExpr(dataType, expr);
    }

    // ========== Helpers: Statements ==========

    /**
     * Wraps a bare return statement used as control structure body in a code block, if inside
     * the entry point.
     */
    private Stmnt makeCodeBlockInEntryPointReturnStmnt(Stmnt bodyStmnt) {
        if (context.isInsideEntryPoint() && bodyStmnt instanceof ReturnStmnt) {
            log.trace("Wrapping return statement in code block at {}", bodyStmnt.getArea());
            return AstFactory.makeCodeBlockStmnt(bodyStmnt);
        }
        return bodyStmnt;
    }

    // ========== Errors ==========

    private ConversionException runtimeErr(String message, Node ast) {
        log.warn("Conversion error at {}: {}", ast.getArea(), message);
        return new ConversionException(message, ast.getArea(), ast.getClass().getSimpleName());
    }
}
