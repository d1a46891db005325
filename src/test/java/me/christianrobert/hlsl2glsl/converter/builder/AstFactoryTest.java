package me.christianrobert.hlsl2glsl.converter.builder;

import me.christianrobert.hlsl2glsl.converter.ast.AssignOp;
import me.christianrobert.hlsl2glsl.converter.ast.BracketExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CastExpr;
import me.christianrobert.hlsl2glsl.converter.ast.CodeBlockStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.FunctionCall;
import me.christianrobert.hlsl2glsl.converter.ast.Intrinsic;
import me.christianrobert.hlsl2glsl.converter.ast.ListExpr;
import me.christianrobert.hlsl2glsl.converter.ast.LiteralExpr;
import me.christianrobert.hlsl2glsl.converter.ast.ReturnStmnt;
import me.christianrobert.hlsl2glsl.converter.ast.SourceArea;
import me.christianrobert.hlsl2glsl.converter.ast.VarAccessExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarDecl;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import org.junit.jupiter.api.Test;

import static me.christianrobert.hlsl2glsl.converter.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AstFactoryTest {

    // ========== Casts ==========

    @Test
    void testMakeLiteralCastExpr() {
        SourceArea area = SourceArea.at(2, 5);

        CastExpr cast = AstFactory.makeLiteralCastExpr(base(DataType.FLOAT2), DataType.INT, "1", area);

        assertEquals(base(DataType.FLOAT2), cast.getCastType());
        assertEquals(base(DataType.FLOAT2), cast.getTypeDenoter());
        assertEquals(area, cast.getArea());
        LiteralExpr literal = assertInstanceOf(LiteralExpr.class, cast.getExpr());
        assertEquals("1", literal.getValue());
        assertEquals(DataType.INT, literal.getDataType());
    }

    @Test
    void testMakeBaseTypeCastExprKeepsOperandArea() {
        LiteralExpr literal = new LiteralExpr(SourceArea.at(8, 3), DataType.INT, "7");

        CastExpr cast = AstFactory.makeBaseTypeCastExpr(DataType.UINT, literal);

        assertSame(literal, cast.getExpr());
        assertEquals(SourceArea.at(8, 3), cast.getArea());
        assertEquals("uint", cast.getTypeDenoter().toTypeString());
    }

    @Test
    void testMakeBracketExprDerivesType() {
        BracketExpr bracket = AstFactory.makeBracketExpr(literal(DataType.HALF, "1h"), AREA);

        assertEquals(base(DataType.HALF), bracket.getTypeDenoter());
    }

    // ========== Statements ==========

    @Test
    void testMakeCodeBlockStmnt() {
        ReturnStmnt ret = new ReturnStmnt(SourceArea.at(5, 9));

        CodeBlockStmnt block = AstFactory.makeCodeBlockStmnt(ret);

        assertEquals(1, block.getCodeBlock().getStmnts().size());
        assertSame(ret, block.getCodeBlock().getStmnts().get(0));
        assertEquals(SourceArea.at(5, 9), block.getArea());
    }

    // ========== Function Calls ==========

    @Test
    void testFindSingleFunctionCall() {
        FunctionCall call = intrinsicCall(Intrinsic.SIN, literal(DataType.FLOAT, "1.0"));

        assertSame(call, AstFactory.findSingleFunctionCall(call));
        assertSame(call, AstFactory.findSingleFunctionCall(new BracketExpr(AREA, new BracketExpr(AREA, call))));
        assertNull(AstFactory.findSingleFunctionCall(literal(DataType.FLOAT, "1.0")));
        assertNull(AstFactory.findSingleFunctionCall(null));
    }

    @Test
    void testMakeSeparatedSinCosFunctionCalls() {
        VarDecl a = varDecl("a", base(DataType.FLOAT2));
        VarDecl s = varDecl("s", base(DataType.FLOAT2));
        VarDecl c = varDecl("c", base(DataType.FLOAT2));
        VarAccessExpr angle = access(a);
        VarAccessExpr sinOut = access(s);
        FunctionCall sincos = intrinsicCall(Intrinsic.SINCOS, angle, sinOut, access(c));

        ListExpr list = AstFactory.makeSeparatedSinCosFunctionCalls(sincos);

        assertNotNull(list);
        VarAccessExpr first = (VarAccessExpr) list.getFirstExpr();
        VarAccessExpr second = (VarAccessExpr) list.getNextExpr();
        assertSame(sinOut.getVarIdent(), first.getVarIdent(), "Output chain is moved, not copied");
        assertEquals(AssignOp.SET, first.getAssignOp());
        assertEquals(AssignOp.SET, second.getAssignOp());

        FunctionCall sin = (FunctionCall) first.getAssignExpr();
        FunctionCall cos = (FunctionCall) second.getAssignExpr();
        assertEquals(Intrinsic.SIN, sin.getIntrinsic());
        assertEquals(Intrinsic.COS, cos.getIntrinsic());
        assertSame(angle, sin.getArguments().get(0));
        assertNotSame(angle, cos.getArguments().get(0));
        assertEquals(base(DataType.FLOAT2), cos.getTypeDenoter());
    }

    @Test
    void testSinCosWithWrongArgumentCountIsRejected() {
        VarDecl a = varDecl("a", base(DataType.FLOAT));

        assertNull(AstFactory.makeSeparatedSinCosFunctionCalls(intrinsicCall(Intrinsic.SINCOS, access(a))));
    }

    @Test
    void testSinCosWithNonVariableOutputIsRejected() {
        VarDecl a = varDecl("a", base(DataType.FLOAT));
        VarDecl s = varDecl("s", base(DataType.FLOAT));
        FunctionCall sincos = intrinsicCall(Intrinsic.SINCOS,
                access(a), access(s), literal(DataType.FLOAT, "0.0"));

        assertNull(AstFactory.makeSeparatedSinCosFunctionCalls(sincos));
    }
}
