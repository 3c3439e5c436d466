package nl.bytesoflife.deltakicad.sexpr;

import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionBuilderTest {

    private final SExpressionWriter writer = new SExpressionWriter();

    @Test
    void padOnOneLine() {
        SList pad = SExpressionBuilder.create("pad")
                .addValue("1")
                .addSymbol("smd")
                .addSymbol("circle")
                .build();
        assertEquals("(pad \"1\" smd circle)\n", writer.write(pad));
    }

    @Test
    void valueKinds() {
        SList list = SExpressionBuilder.create("v")
                .addValue("text")
                .addValue(42)
                .addValue(0.1 + 0.2)
                .addMm(Coord.fromMm("2.54"))
                .addBool(true)
                .addBool(false)
                .build();

        assertEquals(new SString("text"), list.get(1));
        assertEquals("42", list.getString(1));
        assertEquals("0.3", list.getString(2));
        assertEquals("2.54", list.getString(3));
        assertEquals(Boolean.TRUE, list.getBool(4));
        assertEquals(Boolean.FALSE, list.getBool(5));
        assertInstanceOf(SNumber.class, list.get(3));
    }

    @Test
    void nestedChildren() {
        SList list = SExpressionBuilder.create("font")
                .addChild("size", b -> b.addValue(1.27).addValue(1.27))
                .addChild(new SSymbol("bold"))
                .addChildren(List.of(SExpressionBuilder.create("thickness").addValue(0.15).build()))
                .build();

        assertEquals(4, list.size());
        assertEquals("1.27", list.child("size").getString(0));
        assertTrue(list.hasSymbol("bold"));
        assertNotNull(list.child("thickness"));
    }

    @Test
    void rejectsInvalidSymbols() {
        assertThrows(IllegalArgumentException.class, () -> SExpressionBuilder.create("bad name"));
        assertThrows(IllegalArgumentException.class, () -> SExpressionBuilder.create("x").addSymbol(""));
        assertThrows(IllegalArgumentException.class, () -> SExpressionBuilder.create("x").addSymbol("a(b"));
        assertThrows(IllegalArgumentException.class, () -> SExpressionBuilder.create("x").addSymbol("say\"hi"));
        assertThrows(NullPointerException.class, () -> SExpressionBuilder.create("x").addValue((String) null));
    }

    @Test
    void rejectsNonFiniteNumbers() {
        assertThrows(IllegalArgumentException.class, () -> SExpressionBuilder.create("x").addValue(Double.NaN));
    }

    @Test
    void layoutIsDroppedWhenChildCountDiffers() {
        SList source = new SList(List.of(new SSymbol("a"), new SSymbol("b")),
                new ListLayout(List.of(0, 1), 1));
        SList same = SExpressionBuilder.create("a").addSymbol("c").layoutFrom(source).build();
        SList longer = SExpressionBuilder.create("a").addSymbol("c").addSymbol("d").layoutFrom(source).build();

        assertNotNull(same.layout());
        assertNull(longer.layout());
    }
}
