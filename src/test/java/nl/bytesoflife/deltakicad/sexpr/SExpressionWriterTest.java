package nl.bytesoflife.deltakicad.sexpr;

import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.parser.ParseResult;
import nl.bytesoflife.deltakicad.sexpr.parser.SExpressionParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionWriterTest {

    private final SExpressionParser parser = new SExpressionParser();
    private final SExpressionWriter writer = new SExpressionWriter();

    @ParameterizedTest
    @ValueSource(strings = {"plain", "say \"hi\"", "back\\slash", "two\nlines", "\\\"", "", "tab\there", "ünïcode Ω"})
    void stringsSurviveWriteAndParse(String value) {
        SList node = SExpressionBuilder.create("descr").addValue(value).build();
        SList parsed = parser.parse(writer.write(node)).root();
        assertEquals(value, parsed.getString(0));
    }

    @Test
    void escapesQuotesAndBackslashes() {
        assertEquals("\"a\\\"b\\\\c\"", SExpressionWriter.quote("a\"b\\c"));
    }

    @Test
    void parsedStringKeepsOriginalEscapes() {
        SList root = parser.parse("(t \"a\\nb\")").root();
        assertEquals("a\nb", root.getString(0));
        assertEquals("(t \"a\\nb\")\n", writer.write(root));
    }

    @Test
    void freshNumbersAreCanonical() {
        SList node = SExpressionBuilder.create("n")
                .addValue(new BigDecimal("1.500"))
                .addValue(new BigDecimal("1E+2"))
                .addValue(new BigDecimal("-0.0000001"))
                .addValue(new BigDecimal("0.1234565"))
                .addValue(3)
                .build();
        assertEquals("(n 1.5 100 0 0.123457 3)\n", writer.write(node));
    }

    @Test
    void parsedNumbersKeepSpelling() {
        SList root = parser.parse("(at 1.50 -0.0 10)").root();
        assertEquals("(at 1.50 -0.0 10)\n", writer.write(root));
    }

    @Test
    void canonicalLayoutForBuiltTrees() {
        SList tree = SExpressionBuilder.create("footprint")
                .addValue("R_0603")
                .addChild("layer", b -> b.addValue("F.Cu"))
                .addChild("pad", b -> b.addValue("1").addSymbol("smd").addSymbol("rect")
                        .addChild("at", at -> at.addValue(-0.8).addValue(0)))
                .build();

        String expected = """
                (footprint "R_0603"
                \t(layer "F.Cu")
                \t(pad "1" smd rect
                \t\t(at -0.8 0)
                \t)
                )
                """;
        assertEquals(expected, writer.write(tree));
    }

    @Test
    void atomsAfterNestedListGoOnOwnLines() {
        SList tree = SExpressionBuilder.create("property")
                .addValue("Reference")
                .addChild("at", b -> b.addValue(0).addValue(0))
                .addSymbol("hide")
                .build();
        String expected = "(property \"Reference\"\n  (at 0 0)\n  hide\n)\n";
        assertEquals(expected, new SExpressionWriter(SExpressionFormat.KICAD_LEGACY).write(tree));
    }

    @Test
    void parsedLayoutIsReproduced() {
        String text = "(kicad_sch (version 20211123) (generator eeschema)\n\n  (uuid 1e4f1a4e)\n\n  (paper \"A4\")\n)\n";
        ParseResult result = parser.parse(text);
        assertEquals(text, new SExpressionWriter(result.format()).write(result.root()));
    }

    @Test
    void outputEndsWithSingleNewline() {
        String text = writer.write(SList.of(new SNode.SSymbol("a")));
        assertEquals("(a)\n", text);
    }

    @Test
    void writingIsIdempotent() {
        String text = "(a\n\t(b 1 \"x\")\n\t(c\n\t\t(d 2)\n\t)\n)\n";
        String once = writer.write(parser.parse(text).root());
        String twice = writer.write(parser.parse(once).root());
        assertEquals(text, once);
        assertEquals(once, twice);
    }

    @Test
    void crlfInputIsWrittenWithLf() {
        ParseResult result = parser.parse("(a\r\n\t(b 1)\r\n)\r\n");
        assertEquals("(a\n\t(b 1)\n)\n", writer.write(result.root()));
    }

    @Test
    void writesUtf8ToStream() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(SList.of(new SNode.SSymbol("t"), new SString("Ω")), out);
        assertEquals("(t \"Ω\")\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void numberEqualityIsNumeric() {
        assertEquals(SNumber.of(1.5), new SNumber(new BigDecimal("1.50"), "1.50"));
        assertEquals("1.5", SNumber.of(1.5).text());
    }
}
