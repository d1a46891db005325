package me.christianrobert.hlsl2glsl.converter.glsl;

import me.christianrobert.hlsl2glsl.converter.ast.AssignOp;
import me.christianrobert.hlsl2glsl.converter.ast.BracketExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CastExpr;
import me.christianrobert.hlsl2glsl.converter.ast.ExprStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionCall;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionDecl;
import me.christianrobert.hlsl2glsl.converter.ast.Intrinsic;
import me.christianrobert.hlsl2glsl.converter.ast.ListExpr;
import me.christianrobert.hlsl2glsl.converter.ast.LiteralExpr;
import me.christianrobert.hlsl2glsl.converter.ast.Program;
import me.christianrobert.hlsl2glsl.converter.ast.SourceArea;
import me.christianrobert.hlsl2glsl.converter.ast.StructDecl;
import me.christianrobert.hlsl2glsl.converter.ast.VarAccessExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarDecl;
import me.christianrobert.hlsl2glsl.converter.context.ConversionException;
import me.christianrobert.hlsl2glsl.converter.context.ShaderTarget;
import me.christianrobert.hlsl2glsl.converter.type.BaseTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.hlsl2glsl.converter.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for intrinsic and call rewriting.
 *
 * <p>Rewrites:
 * <ul>
 *   <li>saturate(x) → clamp(x, T(0), T(1))</li>
 *   <li>sincos(x, s, c); → s = sin(x), c = cos(x);</li>
 *   <li>f(color, samplerState) → f(color)</li>
 *   <li>1.5h → 1.5f</li>
 * </ul>
 */
class GlslConverterIntrinsicTest {

    private GlslConverter converter;

    @BeforeEach
    void setUp() {
        converter = new GlslConverter();
    }

    private Program convertInEntryPoint(ExprStmnt... stmnts) {
        Program program = program(voidFunction("main", stmnts));
        converter.convert(program, ShaderTarget.FRAGMENT, "xsc_");
        return program;
    }

    // ==================== saturate ====================

    @Test
    void saturateBecomesClampWithCastLiterals() {
        // Given: saturate(v) with v of type float3
        VarDecl v = varDecl("v", base(DataType.FLOAT3));
        FunctionCall call = intrinsicCall(Intrinsic.SATURATE, access(v));

        // When
        convertInEntryPoint(exprStmnt(call));

        // Then: clamp(v, float3(0), float3(1))
        assertEquals(Intrinsic.CLAMP, call.getIntrinsic());
        assertEquals(3, call.getArguments().size());

        CastExpr lower = assertInstanceOf(CastExpr.class, call.getArguments().get(1));
        assertEquals(base(DataType.FLOAT3), lower.getCastType());
        LiteralExpr zero = assertInstanceOf(LiteralExpr.class, lower.getExpr());
        assertEquals("0", zero.getValue());
        assertEquals(DataType.INT, zero.getDataType());

        CastExpr upper = assertInstanceOf(CastExpr.class, call.getArguments().get(2));
        assertEquals(base(DataType.FLOAT3), upper.getCastType());
        assertEquals("1", ((LiteralExpr) upper.getExpr()).getValue());
    }

    @Test
    void saturateOfScalarCastsToScalarType() {
        VarDecl x = varDecl("x", base(DataType.FLOAT));
        FunctionCall call = intrinsicCall(Intrinsic.SATURATE, access(x));

        convertInEntryPoint(exprStmnt(assign(x, call)));

        assertEquals(Intrinsic.CLAMP, call.getIntrinsic());
        assertEquals(base(DataType.FLOAT), ((CastExpr) call.getArguments().get(1)).getCastType());
        assertEquals(base(DataType.FLOAT), ((CastExpr) call.getArguments().get(2)).getCastType());
    }

    @Test
    void saturateWithoutArgumentsFails() {
        FunctionCall call = new FunctionCall(SourceArea.at(4, 12), null, Intrinsic.SATURATE);

        ConversionException e = assertThrows(ConversionException.class,
                () -> convertInEntryPoint(exprStmnt(call)));

        assertEquals("invalid number of arguments in intrinsic 'saturate'", e.getMessage());
        assertEquals(SourceArea.at(4, 12), e.getArea());
        assertEquals("FunctionCall", e.getContext());
    }

    @Test
    void saturateWithTwoArgumentsFails() {
        VarDecl x = varDecl("x", base(DataType.FLOAT));
        FunctionCall call = intrinsicCall(Intrinsic.SATURATE, access(x), literal(DataType.FLOAT, "1.0"));

        ConversionException e = assertThrows(ConversionException.class,
                () -> convertInEntryPoint(exprStmnt(call)));

        assertEquals("invalid number of arguments in intrinsic 'saturate'", e.getMessage());
        assertEquals(Intrinsic.SATURATE, call.getIntrinsic(), "Failed call must not be rewritten");
    }

    @Test
    void saturateOfStructureFails() {
        // Given: saturate(s) with s of a structure type
        VarDecl member = varDecl("value", base(DataType.FLOAT));
        StructDecl struct = struct("Light", member);
        VarDecl s = varDecl("s", structType(struct));
        VarAccessExpr arg = new VarAccessExpr(SourceArea.at(7, 21), chain(s));

        ConversionException e = assertThrows(ConversionException.class,
                () -> convertInEntryPoint(exprStmnt(intrinsicCall(Intrinsic.SATURATE, arg))));

        assertEquals("invalid argument type denoter in intrinsic 'saturate'", e.getMessage());
        assertEquals(SourceArea.at(7, 21), e.getArea());
        assertTrue(e.getDetailedMessage().contains("(at 7:21)"), e.getDetailedMessage());
    }

    // ==================== sincos ====================

    @Test
    void sincosStatementIsSplitIntoTwoAssignments() {
        // Given: sincos(a, s, c);
        VarDecl a = varDecl("a", base(DataType.FLOAT));
        VarDecl s = varDecl("s", base(DataType.FLOAT));
        VarDecl c = varDecl("c", base(DataType.FLOAT));
        ExprStmnt stmnt = exprStmnt(intrinsicCall(Intrinsic.SINCOS, access(a), access(s), access(c)));

        // When
        convertInEntryPoint(stmnt);

        // Then: s = sin(a), c = cos(a);
        ListExpr list = assertInstanceOf(ListExpr.class, stmnt.getExpr());

        VarAccessExpr sinAssign = assertInstanceOf(VarAccessExpr.class, list.getFirstExpr());
        assertEquals("s", sinAssign.getVarIdent().getIdent());
        assertEquals(AssignOp.SET, sinAssign.getAssignOp());
        FunctionCall sin = assertInstanceOf(FunctionCall.class, sinAssign.getAssignExpr());
        assertEquals(Intrinsic.SIN, sin.getIntrinsic());
        assertEquals(1, sin.getArguments().size());

        VarAccessExpr cosAssign = assertInstanceOf(VarAccessExpr.class, list.getNextExpr());
        assertEquals("c", cosAssign.getVarIdent().getIdent());
        FunctionCall cos = assertInstanceOf(FunctionCall.class, cosAssign.getAssignExpr());
        assertEquals(Intrinsic.COS, cos.getIntrinsic());

        VarAccessExpr sinArg = (VarAccessExpr) sin.getArguments().get(0);
        VarAccessExpr cosArg = (VarAccessExpr) cos.getArguments().get(0);
        assertEquals("a", sinArg.getVarIdent().getIdent());
        assertEquals("a", cosArg.getVarIdent().getIdent());
        assertNotSame(sinArg, cosArg, "Angle must be copied, a node has exactly one owner");
        assertSame(a, cosArg.getVarIdent().getSymbolRef());
    }

    @Test
    void bracketedSincosStatementIsSplit() {
        VarDecl a = varDecl("a", base(DataType.FLOAT));
        VarDecl s = varDecl("s", base(DataType.FLOAT));
        VarDecl c = varDecl("c", base(DataType.FLOAT));
        ExprStmnt stmnt = exprStmnt(new BracketExpr(AREA,
                intrinsicCall(Intrinsic.SINCOS, access(a), access(s), access(c))));

        convertInEntryPoint(stmnt);

        assertInstanceOf(ListExpr.class, stmnt.getExpr());
    }

    @Test
    void nestedSincosIsNotSplit() {
        // Given: x = sincos(a, s, c); the call is not the sole expression of the statement
        VarDecl a = varDecl("a", base(DataType.FLOAT));
        VarDecl s = varDecl("s", base(DataType.FLOAT));
        VarDecl c = varDecl("c", base(DataType.FLOAT));
        VarDecl x = varDecl("x", base(DataType.FLOAT));
        FunctionCall call = intrinsicCall(Intrinsic.SINCOS, access(a), access(s), access(c));
        ExprStmnt stmnt = exprStmnt(assign(x, call));

        convertInEntryPoint(stmnt);

        assertInstanceOf(VarAccessExpr.class, stmnt.getExpr());
        assertEquals(Intrinsic.SINCOS, call.getIntrinsic());
        assertEquals(3, call.getArguments().size());
    }

    @Test
    void sincosWithUnexpectedShapeIsLeftUntouched() {
        VarDecl a = varDecl("a", base(DataType.FLOAT));
        VarDecl s = varDecl("s", base(DataType.FLOAT));
        FunctionCall call = intrinsicCall(Intrinsic.SINCOS, access(a), access(s));
        ExprStmnt stmnt = exprStmnt(call);

        convertInEntryPoint(stmnt);

        assertSame(call, stmnt.getExpr());
    }

    // ==================== Sampler state arguments ====================

    @Test
    void samplerArgumentsAndParametersOfUserFunctionsAreRemoved() {
        // Given: float4 shade(float4 color, SamplerState samp) and a call shade(c, s)
        VarDecl color = varDecl("color", base(DataType.FLOAT4));
        VarDecl samp = varDecl("samp", sampler());
        FunctionDecl shade = function("shade", base(DataType.FLOAT4));
        shade.addParameter(declStmnt(color));
        shade.addParameter(declStmnt(samp));

        VarDecl c = varDecl("c", base(DataType.FLOAT4));
        VarDecl s = varDecl("s", sampler());
        FunctionCall call = userCall(shade, access(c), access(s));

        Program program = program(voidFunction("main", exprStmnt(call)), functionStmnt(shade));

        // When
        converter.convert(program, ShaderTarget.FRAGMENT, "xsc_");

        // Then
        assertEquals(1, call.getArguments().size());
        assertEquals("c", ((VarAccessExpr) call.getArguments().get(0)).getVarIdent().getIdent());
        assertEquals(1, shade.getParameters().size());
        assertSame(color, shade.getParameters().get(0).getVarDecls().get(0));
    }

    @Test
    void samplerArgumentsOfIntrinsicsAreKept() {
        VarDecl tex = varDecl("tex", base(DataType.FLOAT4));
        VarDecl s = varDecl("s", sampler());
        VarDecl uv = varDecl("uv", base(DataType.FLOAT2));
        FunctionCall call = intrinsicCall(Intrinsic.TEX_SAMPLE, access(s), access(uv));
        call.setTypeDenoter(base(DataType.FLOAT4));

        convertInEntryPoint(exprStmnt(assign(tex, call)));

        assertEquals(2, call.getArguments().size());
    }

    // ==================== Literals ====================

    @Test
    void halfLiteralSuffixBecomesFloatSuffix() {
        LiteralExpr lower = literal(DataType.HALF, "1.5h");
        LiteralExpr upper = literal(DataType.HALF, "2.0H");
        VarDecl x = varDecl("x", base(DataType.HALF));

        convertInEntryPoint(exprStmnt(assign(x, lower)), exprStmnt(assign(x, upper)));

        assertEquals("1.5f", lower.getValue());
        assertEquals(DataType.FLOAT, lower.getDataType());
        assertEquals("2.0f", upper.getValue());
        assertEquals(DataType.FLOAT, upper.getDataType());
    }

    @Test
    void otherLiteralsAreUnchanged() {
        LiteralExpr floatLiteral = literal(DataType.FLOAT, "1.5f");
        LiteralExpr intLiteral = literal(DataType.INT, "42");
        VarDecl x = varDecl("x", base(DataType.FLOAT));
        VarDecl i = varDecl("i", base(DataType.INT));

        convertInEntryPoint(exprStmnt(assign(x, floatLiteral)), exprStmnt(assign(i, intLiteral)));

        assertEquals("1.5f", floatLiteral.getValue());
        assertEquals(DataType.FLOAT, floatLiteral.getDataType());
        assertEquals("42", intLiteral.getValue());
        assertEquals(BaseTypeDenoter.of(DataType.INT), intLiteral.getTypeDenoter());
    }
}
