package me.christianrobert.hlsl2glsl.converter.ast;

import me.christianrobert.hlsl2glsl.converter.type.DataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.hlsl2glsl.converter.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class VarIdentTest {

    private VarDecl light;
    private VarDecl color;
    private VarDecl red;

    @BeforeEach
    void setUp() {
        red = varDecl("r", base(DataType.FLOAT));
        color = varDecl("color", base(DataType.FLOAT3));
        light = varDecl("light", structType(struct("Light", color)));
    }

    @Test
    void testToStringShowsPathWithIndices() {
        VarIdent root = chain(light, color, red);
        root.getArrayIndices().add(literal(DataType.INT, "0"));

        assertEquals("light[].color.r", root.toString());
    }

    @Test
    void testPopFrontTakesOverSuccessor() {
        VarIdent root = chain(light, color, red);
        LiteralExpr index = literal(DataType.INT, "2");
        root.getNext().getArrayIndices().add(index);

        root.popFront();

        assertEquals("color", root.getIdent());
        assertSame(color, root.getSymbolRef());
        assertEquals(1, root.getArrayIndices().size());
        assertSame(index, root.getArrayIndices().get(0));
        assertEquals("r", root.getNext().getIdent());
        assertEquals("color[].r", root.toString());
    }

    @Test
    void testPopFrontOnTerminalSegmentDoesNothing() {
        VarIdent root = chain(light);

        root.popFront();

        assertEquals("light", root.getIdent());
        assertSame(light, root.getSymbolRef());
    }

    @Test
    void testTypeOfChainIsTypeOfLastSegment() {
        VarIdent root = chain(light, color);

        assertSame(color, root.getLastVarIdent().getSymbolRef());
        assertEquals(base(DataType.FLOAT3), root.getTypeDenoter());
        assertNull(new VarIdent(AREA, "unresolved").getTypeDenoter());
    }

    @Test
    void testGetVarDeclRefIgnoresOtherSymbols() {
        FunctionDecl function = voidFunction("helper");
        VarIdent callee = new VarIdent(AREA, "helper", function);

        assertNull(callee.getVarDeclRef());
        assertSame(light, chain(light).getVarDeclRef());
    }

    @Test
    void testCopyIsDeep() {
        VarIdent root = chain(light, color);
        root.getArrayIndices().add(literal(DataType.INT, "1"));

        VarIdent copy = root.copy();
        copy.popFront();

        assertEquals("light[].color", root.toString());
        assertEquals("color", copy.toString());
        assertNotSame(root.getArrayIndices().get(0), root.copy().getArrayIndices().get(0));
        assertSame(light, root.copy().getSymbolRef());
    }

    @Test
    void testEmptyIdentifierIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new VarIdent(AREA, " "));
        assertThrows(IllegalArgumentException.class, () -> new VarIdent(AREA, null));
    }
}
