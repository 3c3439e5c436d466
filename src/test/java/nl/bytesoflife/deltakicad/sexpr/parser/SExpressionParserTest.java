package nl.bytesoflife.deltakicad.sexpr.parser;

import nl.bytesoflife.deltakicad.sexpr.ListLayout;
import nl.bytesoflife.deltakicad.sexpr.SExpressionFormat;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseNestedListWithAllAtomKinds() {
        ParseResult result = parser.parse("(foo (bar 1.5 \"x\\\"y\") baz)");
        assertFalse(result.hasErrors());

        SList foo = result.root();
        assertEquals("foo", foo.tag());
        assertEquals(3, foo.size());

        SList bar = assertInstanceOf(SList.class, foo.get(1));
        assertEquals("bar", bar.tag());
        SNumber number = assertInstanceOf(SNumber.class, bar.get(1));
        assertEquals(0, new BigDecimal("1.5").compareTo(number.value()));
        SString string = assertInstanceOf(SString.class, bar.get(2));
        assertEquals("x\"y", string.value());

        assertEquals(new SSymbol("baz"), foo.get(2));
    }

    @Test
    void classifiesNumbers() {
        SList list = parser.parse("(n 1 -2 +3 .5 4. 1e5 0x10 1.2.3 -)").root();
        assertInstanceOf(SNumber.class, list.get(1));
        assertInstanceOf(SNumber.class, list.get(2));
        assertInstanceOf(SNumber.class, list.get(3));
        assertInstanceOf(SNumber.class, list.get(4));
        assertInstanceOf(SNumber.class, list.get(5));
        assertInstanceOf(SSymbol.class, list.get(6));
        assertInstanceOf(SSymbol.class, list.get(7));
        assertInstanceOf(SSymbol.class, list.get(8));
        assertInstanceOf(SSymbol.class, list.get(9));
    }

    @Test
    void keepsNumberSpelling() {
        SList list = parser.parse("(at 1.50 -0 007)").root();
        assertEquals("1.50", list.getString(0));
        assertEquals("-0", list.getString(1));
        assertEquals("007", list.getString(2));
        assertEquals(Integer.valueOf(7), list.getInt(2));
    }

    @Test
    void quotedNumbersStayStrings() {
        SList list = parser.parse("(pad \"1\" smd)").root();
        assertInstanceOf(SString.class, list.get(1));
        assertNull(list.getNumber(0));
        assertEquals("1", list.getString(0));
    }

    @Test
    void truncatedInputKeepsPrecedingContent() {
        String text = "(kicad_pcb\n\t(version 20240108)\n\t(net 0 \"\")\n\t(net 1 \"GND\"";
        ParseResult result = assertDoesNotThrow(() -> parser.parse(text));

        assertTrue(result.hasErrors());
        assertFalse(result.getErrors().isEmpty());
        SList root = result.root();
        assertEquals("kicad_pcb", root.tag());
        assertEquals(Integer.valueOf(20240108), root.child("version").getInt(0));
        List<SList> nets = root.children("net");
        assertEquals(2, nets.size());
        assertEquals("GND", nets.get(1).getString(1));
    }

    @Test
    void strayCloseParenIsReported() {
        ParseResult result = parser.parse("(a (b)))");
        assertTrue(result.hasErrors());
        assertEquals("a", result.root().tag());
        assertEquals(2, result.root().size());
    }

    @Test
    void atomOutsideListIsReported() {
        ParseResult result = parser.parse("junk (a 1)");
        assertTrue(result.hasErrors());
        assertEquals("a", result.root().tag());
    }

    @Test
    void contentAfterRootIsReported() {
        ParseResult result = parser.parse("(a 1)(b 2)");
        assertTrue(result.hasErrors());
        assertEquals("a", result.root().tag());
    }

    @Test
    void emptyInputYieldsEmptyRootAndError() {
        ParseResult result = parser.parse("   ");
        assertTrue(result.hasErrors());
        assertEquals(0, result.root().size());
    }

    @Test
    void errorsCarrySourceLocation() {
        ParseResult result = parser.parse("(a\n  (b 1)\n  )\n)");
        assertEquals(1, result.getErrors().size());
        assertEquals(4, result.getErrors().get(0).location().line());
    }

    @Test
    void detectsTabIndent() {
        ParseResult result = parser.parse("(kicad_sch\n\t(version 20231120)\n)");
        assertEquals(SExpressionFormat.KICAD_CURRENT, result.format());
    }

    @Test
    void detectsTwoSpaceIndent() {
        ParseResult result = parser.parse("(kicad_sch (version 20211123)\n  (lib_symbols\n    (symbol \"R\")\n  )\n)");
        assertEquals(SExpressionFormat.KICAD_LEGACY, result.format());
    }

    @Test
    void detectsFourSpaceIndent() {
        ParseResult result = parser.parse("(kicad_pcb\n    (general\n        (thickness 1.6)\n    )\n)");
        assertEquals(SExpressionFormat.spaces(4), result.format());
        assertEquals("    ", result.format().indentUnit());
    }

    @Test
    void singleLineInputFallsBackToTabs() {
        assertEquals(SExpressionFormat.KICAD_CURRENT, parser.parse("(a (b 1))").format());
    }

    @Test
    void capturesLineBreaks() {
        SList root = parser.parse("(a 1\n\t(b 2)\n\n\t(c)\n)").root();
        ListLayout layout = root.layout();
        assertNotNull(layout);
        assertEquals(List.of(0, 0, 1, 2), layout.breaksBefore());
        assertEquals(1, layout.breaksBeforeClose());

        SList b = root.child("b");
        assertEquals(List.of(0, 0), b.layout().breaksBefore());
        assertEquals(0, b.layout().breaksBeforeClose());
    }

    @Test
    void deepNestingDoesNotOverflowStack() {
        int depth = 100_000;
        String text = "(n ".repeat(depth) + ")".repeat(depth);
        ParseResult result = parser.parse(text);
        assertFalse(result.hasErrors());

        SNode node = result.root();
        int levels = 0;
        while (node instanceof SList list && list.size() > 1) {
            node = list.get(1);
            levels++;
        }
        assertEquals(depth - 1, levels);
    }

    @Test
    void equalityIgnoresSpellingAndLayout() {
        SList a = parser.parse("(at 1.50 2)").root();
        SList b = parser.parse("(at\n\t1.5\n\t2.0\n)").root();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
