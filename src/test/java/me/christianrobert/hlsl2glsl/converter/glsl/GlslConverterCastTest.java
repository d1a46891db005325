package me.christianrobert.hlsl2glsl.converter.glsl;

import me.christianrobert.hlsl2glsl.converter.ast.BinaryExpr;
import me.christianrobert.hlsl2glsl.converter.ast.BinaryOp;
import me.christianrobert.hlsl2glsl.converter.ast.CastExpr;
import me.christianrobert.hlsl2glsl.converter.ast.Expr;
import me.christianrobert.hlsl2glsl.converter.ast.Program;
import me.christianrobert.hlsl2glsl.converter.ast.Stmnt;
import me.christianrobert.hlsl2glsl.converter.ast.VarAccessExpr;
import me.christianrobert.hlsl2glsl.converter.ast.VarDecl;
import me.christianrobert.hlsl2glsl.converter.context.ShaderTarget;
import me.christianrobert.hlsl2glsl.converter.type.AliasTypeDenoter;
import me.christianrobert.hlsl2glsl.converter.type.DataType;
import me.christianrobert.hlsl2glsl.converter.type.VoidTypeDenoter;
import org.junit.jupiter.api.Test;

import static me.christianrobert.hlsl2glsl.converter.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for implicit int/uint conversions, which GLSL requires to be explicit.
 *
 * <pre>
 * uint u = i;    →   uint u = uint(i);
 * i = u;         →   i = int(u);
 * u + i          →   u + uint(i)
 * </pre>
 */
class GlslConverterCastTest {

    private void convert(Stmnt... stmnts) {
        Program program = program(voidFunction("main", stmnts));
        new GlslConverter().convert(program, ShaderTarget.FRAGMENT, "xsc_");
    }

    private static void assertCastTo(DataType expected, Expr expr, Expr original) {
        CastExpr cast = assertInstanceOf(CastExpr.class, expr);
        assertEquals(base(expected), cast.getCastType());
        assertSame(original, cast.getExpr());
    }

    // ==================== Initializers ====================

    @Test
    void intInitializerOfUintVariableIsCast() {
        VarDecl i = varDecl("i", base(DataType.INT));
        VarAccessExpr init = access(i);
        VarDecl u = varDecl("u", base(DataType.UINT), init);

        convert(declStmnt(u));

        assertCastTo(DataType.UINT, u.getInitializer(), init);
    }

    @Test
    void uintInitializerOfIntVariableIsCast() {
        VarDecl u = varDecl("u", base(DataType.UINT));
        VarAccessExpr init = access(u);
        VarDecl i = varDecl("i", base(DataType.INT), init);

        convert(declStmnt(i));

        assertCastTo(DataType.INT, i.getInitializer(), init);
    }

    @Test
    void intInitializerOfFloatVariableIsNotCast() {
        VarDecl i = varDecl("i", base(DataType.INT));
        VarAccessExpr init = access(i);
        VarDecl f = varDecl("f", base(DataType.FLOAT), init);

        convert(declStmnt(f));

        assertSame(init, f.getInitializer());
    }

    @Test
    void literalInitializerIsCast() {
        VarDecl u = varDecl("u", base(DataType.UINT), literal(DataType.INT, "5"));

        convert(declStmnt(u));

        CastExpr cast = assertInstanceOf(CastExpr.class, u.getInitializer());
        assertEquals("uint", cast.getCastType().toTypeString());
    }

    // ==================== Binary Expressions ====================

    @Test
    void rhsOfBinaryExpressionIsCastToLhsType() {
        // Given: r = u + i
        VarDecl u = varDecl("u", base(DataType.UINT));
        VarDecl i = varDecl("i", base(DataType.INT));
        VarDecl r = varDecl("r", base(DataType.UINT));
        VarAccessExpr rhs = access(i);
        BinaryExpr sum = new BinaryExpr(AREA, access(u), BinaryOp.ADD, rhs);

        // When
        convert(exprStmnt(assign(r, sum)));

        // Then: r = u + uint(i)
        assertCastTo(DataType.UINT, sum.getRhsExpr(), rhs);
    }

    @Test
    void matchingBinaryOperandsAreNotCast() {
        VarDecl a = varDecl("a", base(DataType.INT));
        VarDecl b = varDecl("b", base(DataType.INT));
        VarAccessExpr rhs = access(b);
        BinaryExpr sum = new BinaryExpr(AREA, access(a), BinaryOp.ADD, rhs);

        convert(exprStmnt(sum));

        assertSame(rhs, sum.getRhsExpr());
    }

    // ==================== Assignments ====================

    @Test
    void assignedValueIsCastToTargetType() {
        VarDecl i = varDecl("i", base(DataType.INT));
        VarDecl u = varDecl("u", base(DataType.UINT));
        VarAccessExpr value = access(u);
        VarAccessExpr assignment = assign(i, value);

        convert(exprStmnt(assignment));

        assertCastTo(DataType.INT, assignment.getAssignExpr(), value);
    }

    @Test
    void equallyShapedVectorsAreCast() {
        VarDecl v = varDecl("v", base(DataType.INT3));
        VarDecl w = varDecl("w", base(DataType.UINT3));
        VarAccessExpr value = access(v);
        VarAccessExpr assignment = assign(w, value);

        convert(exprStmnt(assignment));

        assertCastTo(DataType.UINT3, assignment.getAssignExpr(), value);
    }

    @Test
    void differentlyShapedVectorsAreNotCast() {
        VarDecl v = varDecl("v", base(DataType.INT2));
        VarDecl w = varDecl("w", base(DataType.UINT3));
        VarAccessExpr value = access(v);
        VarAccessExpr assignment = assign(w, value);

        convert(exprStmnt(assignment));

        assertSame(value, assignment.getAssignExpr());
    }

    // ==================== Cast Decision ====================

    @Test
    void castDecisionOnBaseTypes() {
        assertEquals(DataType.UINT, GlslConverterVisitor.mustCastExprToDataType(base(DataType.UINT), base(DataType.INT)));
        assertEquals(DataType.INT, GlslConverterVisitor.mustCastExprToDataType(base(DataType.INT), base(DataType.UINT)));
        assertEquals(DataType.INT4, GlslConverterVisitor.mustCastExprToDataType(base(DataType.INT4), base(DataType.UINT4)));
        assertNull(GlslConverterVisitor.mustCastExprToDataType(base(DataType.INT), base(DataType.INT)));
        assertNull(GlslConverterVisitor.mustCastExprToDataType(base(DataType.FLOAT), base(DataType.INT)));
        assertNull(GlslConverterVisitor.mustCastExprToDataType(base(DataType.UINT), base(DataType.FLOAT)));
        assertNull(GlslConverterVisitor.mustCastExprToDataType(base(DataType.UINT2), base(DataType.INT)));
    }

    @Test
    void castDecisionResolvesAliases() {
        AliasTypeDenoter dword = new AliasTypeDenoter("DWORD", base(DataType.UINT));

        assertEquals(DataType.UINT, GlslConverterVisitor.mustCastExprToDataType(dword, base(DataType.INT)));
    }

    @Test
    void castDecisionIgnoresNonBaseTypes() {
        assertNull(GlslConverterVisitor.mustCastExprToDataType(VoidTypeDenoter.INSTANCE, base(DataType.INT)));
        assertNull(GlslConverterVisitor.mustCastExprToDataType(base(DataType.UINT), sampler()));
    }
}
