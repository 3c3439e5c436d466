package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SExpressionWriter;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.parser.SExpressionParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CoordTest {

    @ParameterizedTest
    @ValueSource(strings = {"0", "1", "1.5", "-1.5", "0.000001", "2.54", "127.000001", "-0.1", "100.25", "0.35"})
    void decimalMillimetresConvertWithoutDrift(String mm) {
        Coord coord = Coord.fromMm(mm);
        assertEquals(mm, coord.toMmDecimal().toPlainString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.27", "-3.81", "0.000001", "152.4", "0.1"})
    void writtenNumberParsesBackToSameCoord(String mm) {
        Coord coord = Coord.fromMm(mm);
        SList node = SExpressionBuilder.create("width").addMm(coord).build();
        String text = new SExpressionWriter().write(node);

        SList parsed = new SExpressionParser().parse(text).root();
        assertEquals(coord, parsed.getCoord(0));
    }

    @Test
    void storesNanometres() {
        assertEquals(1_270_000L, Coord.fromMm("1.27").toNm());
        assertEquals(1L, Coord.fromMm("0.000001").toNm());
        assertEquals(-2_540_000L, Coord.fromMm(-2.54).toNm());
    }

    @Test
    void roundsBeyondSixDigitsHalfUp() {
        assertEquals(1L, Coord.fromMm("0.0000005").toNm());
        assertEquals(0L, Coord.fromMm("0.0000004").toNm());
    }

    @Test
    void rejectsNonFiniteValues() {
        assertThrows(IllegalArgumentException.class, () -> Coord.fromMm(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Coord.fromMm(Double.POSITIVE_INFINITY));
    }

    @Test
    void arithmetic() {
        Coord a = Coord.fromMm("1.5");
        Coord b = Coord.fromMm("0.25");
        assertEquals(Coord.fromMm("1.75"), a.plus(b));
        assertEquals(Coord.fromMm("1.25"), a.minus(b));
        assertEquals(Coord.fromMm("3"), a.times(2));
        assertEquals(Coord.fromMm("0.75"), a.dividedBy(2));
        assertEquals(Coord.fromMm("-1.5"), a.negate());
        assertEquals(a, a.negate().abs());
        assertEquals(b, Coord.min(a, b));
        assertEquals(a, Coord.max(a, b));
    }

    @Test
    void integerDivisionIsExactAndRoundsHalfUp() {
        long beyondDoublePrecision = (1L << 53) + 1;
        assertEquals(beyondDoublePrecision, Coord.fromNm(beyondDoublePrecision).dividedBy(1).toNm());
        assertEquals(3, Coord.fromNm(5).dividedBy(2).toNm());
        assertEquals(-3, Coord.fromNm(-5).dividedBy(2).toNm());
        assertEquals(1, Coord.fromNm(4).dividedBy(3).toNm());
        assertThrows(ArithmeticException.class, () -> Coord.fromNm(Long.MIN_VALUE).dividedBy(-1));
    }

    @Test
    void divisionByZeroFails() {
        assertThrows(ArithmeticException.class, () -> Coord.fromMm(1).dividedBy(0));
    }

    @Test
    void overflowFails() {
        assertThrows(ArithmeticException.class, () -> Coord.fromNm(Long.MAX_VALUE).plus(Coord.fromNm(1)));
    }

    @Test
    void equalityIgnoresSpelling() {
        assertEquals(Coord.fromMm("1.50"), Coord.fromMm("1.5"));
        assertEquals(Coord.fromMm("1.50").hashCode(), Coord.fromMm("1.5").hashCode());
        assertTrue(Coord.fromMm("1").compareTo(Coord.fromMm("2")) < 0);
        assertEquals("1.5mm", Coord.fromMm("1.50").toString());
    }
}
