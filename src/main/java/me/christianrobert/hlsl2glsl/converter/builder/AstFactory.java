package me.christianrobert.hlsl2glsl.converter.builder;

import me.christianrobert.hlsl2glsl.converter.ast.AssignOp;
import me.christianrobert.hlsl2glsl.converter.ast.BracketExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CastExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CodeBlock;
import me.christianrobert.hlsl2glsl.converter.ast.CodeBlockStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.Expr;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionCall;
import me.christianrobert.hlsl2glsl.converter.ast.Intrinsic;
import me.christianrobert.hlsl2glsl.converter.ast.ListExpr;
import me.christianrobert.hlsl2glsl.converter.ast.LiteralExpr;
import me.christianrobert.hlsl2glsl.converter.ast.SourceArea;
import me.christianrobert.hlsl2glsl.converter.ast.Stmnt;
import me.christianrobert.hlsl2glsl.converter.ast.VarAccessExpr;
import me.christianrobert.hlsl2glsl.converter.type.BaseTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import me.christianrobert.hlsl2glsl.converter.type.TypeDenoter;

import java.util.List;

/**
 * Constructors for subtrees synthesized during legalization.
 *
 * <p>The factory never decides <em>when</em> a subtree is needed; it only builds it. All methods
 * are free of side effects apart from moving the passed-in nodes into the new subtree, so the
 * caller must store the result in the slot the inputs came from.</p>
 */
public final class AstFactory {

    private AstFactory() {
    }

    // ========== Casts ==========

    /**
     * Builds {@code T(value)}: a literal of the given data type cast to the target type.
     *
     * <p>Example: {@code makeLiteralCastExpr(float3, INT, "0")} yields {@code float3(0)}.</p>
     *
     * @param targetType Type the literal is cast to
     * @param literalType Data type of the literal itself
     * @param value Printed literal value
     * @param area Source area of the synthesized nodes
     * @return Cast expression wrapping the literal
     */
    public static CastExpr makeLiteralCastExpr(TypeDenoter targetType, DataType literalType, String value, SourceArea area) {
        LiteralExpr literal = new LiteralExpr(area, literalType, value);
        return new CastExpr(area, targetType, literal);
    }

    /**
     * Wraps the expression in a cast to the given base data type.
     */
    public static CastExpr makeBaseTypeCastExpr(DataType dataType, Expr expr) {
        return new CastExpr(expr.getArea(), BaseTypeDenoter.of(dataType), expr);
    }

    /**
     * Wraps the expression in an explicit grouping.
     */
    public static BracketExpr makeBracketExpr(Expr expr, SourceArea area) {
        return new BracketExpr(area, expr);
    }

    // ========== Statements ==========

    /**
     * Wraps the statement in a code block statement: {@code stmnt} becomes {@code { stmnt }}.
     */
    public static CodeBlockStmnt makeCodeBlockStmnt(Stmnt stmnt) {
        CodeBlock codeBlock = new CodeBlock(stmnt.getArea());
        codeBlock.addStmnt(stmnt);
        return new CodeBlockStmnt(stmnt.getArea(), codeBlock);
    }

    // ========== Function Calls ==========

    /**
     * Returns the function call the expression consists of, looking through brackets.
     *
     * @return The single call, or null if the expression is anything else
     */
    public static FunctionCall findSingleFunctionCall(Expr expr) {
        if (expr instanceof FunctionCall) {
            return (FunctionCall) expr;
        }
        if (expr instanceof BracketExpr) {
            return findSingleFunctionCall(((BracketExpr) expr).getExpr());
        }
        return null;
    }

    /**
     * Splits {@code sincos(x, s, c)} into {@code s = sin(x), c = cos(x)}.
     *
     * <p>The output arguments must be plain variable accesses. Their identifier chains are moved
     * into the new assignments and {@code x} is copied for the second call, so the original call
     * must be discarded by the caller.</p>
     *
     * @param sinCosCall Call tagged with {@link Intrinsic#SINCOS}
     * @return List expression of both assignments, or null if the call does not have that shape
     */
    public static ListExpr makeSeparatedSinCosFunctionCalls(FunctionCall sinCosCall) {
        List<Expr> args = sinCosCall.getArguments();
        if (args.size() != 3) {
            return null;
        }
        if (!isPlainVarAccess(args.get(1)) || !isPlainVarAccess(args.get(2))) {
            return null;
        }

        Expr angle = args.get(0);
        VarAccessExpr sinOutput = (VarAccessExpr) args.get(1);
        VarAccessExpr cosOutput = (VarAccessExpr) args.get(2);
        SourceArea area = sinCosCall.getArea();

        Expr sinAssign = makeIntrinsicAssignment(sinOutput, Intrinsic.SIN, angle, area);
        Expr cosAssign = makeIntrinsicAssignment(cosOutput, Intrinsic.COS, angle.copy(), area);

        return new ListExpr(area, sinAssign, cosAssign);
    }

    private static VarAccessExpr makeIntrinsicAssignment(VarAccessExpr output, Intrinsic intrinsic, Expr argument, SourceArea area) {
        FunctionCall call = new FunctionCall(area, null, intrinsic);
        call.addArgument(argument);
        return new VarAccessExpr(output.getArea(), output.getVarIdent(), AssignOp.SET, call);
    }

    private static boolean isPlainVarAccess(Expr expr) {
        return expr instanceof VarAccessExpr && !((VarAccessExpr) expr).isAssignment();
    }
}
