package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.sexpr.SExpressionWriter;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;
import nl.bytesoflife.deltakicad.sexpr.parser.SExpressionParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldCodecTest {

    private final SExpressionParser parser = new SExpressionParser();
    private final SExpressionWriter writer = new SExpressionWriter();

    private SList parse(String text) {
        return parser.parse(text).root();
    }

    private String write(SNode node) {
        return writer.write((SList) node).trim();
    }

    @Test
    void readTextRecordsAtomStyle() {
        EncodedValue<String> bare = FieldCodec.readText(parse("(fp (layer F.Cu))"), "layer");
        EncodedValue<String> quoted = FieldCodec.readText(parse("(fp (layer \"F.Cu\"))"), "layer");

        assertEquals("F.Cu", bare.getValue());
        assertEquals(AtomStyle.SYMBOL, bare.getAtomStyle());
        assertEquals(AtomStyle.STRING, quoted.getAtomStyle());
    }

    @Test
    void changedTextKeepsItsStyle() {
        EncodedValue<String> bare = FieldCodec.readText(parse("(fp (layer F.Cu))"), "layer").withValue("B.Cu");
        assertEquals("(layer B.Cu)", write(FieldCodec.textNode("layer", bare, AtomStyle.STRING)));
    }

    @Test
    void freshTextUsesCanonicalStyle() {
        assertEquals("(layer \"B.Cu\")", write(FieldCodec.textNode("layer", EncodedValue.fresh("B.Cu"), AtomStyle.STRING)));
    }

    @Test
    void symbolStyleFallsBackToStringForUnsafeText() {
        EncodedValue<String> field = EncodedValue.fresh("My Part").withAtomStyle(AtomStyle.SYMBOL);
        assertEquals("(descr \"My Part\")", write(FieldCodec.textNode("descr", field, AtomStyle.STRING)));
    }

    @Test
    void absentTextIsNotWritten() {
        assertNull(FieldCodec.textNode("descr", FieldCodec.readText(parse("(fp)"), "descr"), AtomStyle.STRING));
    }

    @Test
    void unchangedFieldReturnsSourceNode() {
        SList root = parse("(sch (paper \"A3\" portrait))");
        EncodedValue<String> paper = FieldCodec.readText(root, "paper");
        assertSame(root.child("paper"), FieldCodec.textNode("paper", paper, AtomStyle.STRING));
    }

    @Test
    void legacyTimestampIsReadAsUuid() {
        EncodedValue<String> uuid = FieldCodec.readUuid(parse("(fp (tstamp 5C9B1B7F))"));
        assertEquals("5C9B1B7F", uuid.getValue());
        assertEquals("tstamp", uuid.getTokenName());
        assertEquals("(tstamp 5C9B1B7F)", write(FieldCodec.uuidNode(uuid)));
    }

    @Test
    void changedTimestampKeepsLegacyToken() {
        EncodedValue<String> uuid = FieldCodec.readUuid(parse("(fp (tstamp 5C9B1B7F))")).withValue("5C9B1B80");
        assertEquals("(tstamp 5C9B1B80)", write(FieldCodec.uuidNode(uuid)));
    }

    @Test
    void freshUuidIsQuoted() {
        EncodedValue<String> uuid = EncodedValue.fresh("0b2e7c1e-0000-4000-8000-000000000001");
        assertEquals("(uuid \"0b2e7c1e-0000-4000-8000-000000000001\")", write(FieldCodec.uuidNode(uuid)));
        assertTrue(FieldCodec.isUuid(FieldCodec.uuidNode(uuid)));
    }

    @Test
    void readsBareFlag() {
        EncodedValue<Boolean> hide = FieldCodec.readFlag(parse("(effects (font (size 1 1)) hide)"), "hide");
        assertTrue(hide.getValue());
        assertEquals(FlagStyle.BARE_SYMBOL, hide.getFlagStyle());
    }

    @Test
    void readsChildNodeFlag() {
        EncodedValue<Boolean> yes = FieldCodec.readFlag(parse("(effects (hide yes))"), "hide");
        EncodedValue<Boolean> no = FieldCodec.readFlag(parse("(effects (hide no))"), "hide");
        EncodedValue<Boolean> bareNode = FieldCodec.readFlag(parse("(effects (hide))"), "hide");

        assertTrue(yes.getValue());
        assertEquals(FlagStyle.CHILD_NODE, yes.getFlagStyle());
        assertFalse(no.getValue());
        assertTrue(no.isExplicit());
        assertTrue(bareNode.getValue());
    }

    @Test
    void missingFlagIsFalseAndAbsent() {
        EncodedValue<Boolean> hide = FieldCodec.readFlag(parse("(effects (font (size 1 1)))"), "hide");
        assertFalse(hide.getValue());
        assertFalse(hide.isExplicit());
        assertNull(FieldCodec.flagNode("hide", hide, FlagStyle.CHILD_NODE));
    }

    @Test
    void bareFlagStaysBareWhenSetAgain() {
        EncodedValue<Boolean> hide = FieldCodec.readFlag(parse("(effects hide)"), "hide");
        EncodedValue<Boolean> cleared = hide.withValue(false);
        assertNull(FieldCodec.flagNode("hide", cleared, FlagStyle.CHILD_NODE));

        SNode restored = FieldCodec.flagNode("hide", cleared.withValue(true), FlagStyle.CHILD_NODE);
        assertEquals(new SSymbol("hide"), restored);
    }

    @Test
    void clearedChildNodeFlagIsOmitted() {
        EncodedValue<Boolean> hide = FieldCodec.readFlag(parse("(effects (hide yes))"), "hide").withValue(false);
        assertNull(FieldCodec.flagNode("hide", hide, FlagStyle.CHILD_NODE));
        assertEquals("(hide yes)", write(FieldCodec.flagNode("hide", hide.withValue(true), FlagStyle.CHILD_NODE)));
    }

    @Test
    void explicitNoIsKeptWhileUnchanged() {
        SList effects = parse("(effects (hide no))");
        EncodedValue<Boolean> hide = FieldCodec.readFlag(effects, "hide").withValue(false);
        assertSame(effects.child("hide"), FieldCodec.flagNode("hide", hide, FlagStyle.CHILD_NODE));
    }

    @Test
    void freshFlagUsesCanonicalStyle() {
        EncodedValue<Boolean> fresh = EncodedValue.absent(Boolean.FALSE).withValue(true);
        assertEquals("(hide yes)", write(FieldCodec.flagNode("hide", fresh, FlagStyle.CHILD_NODE)));
        assertEquals(new SSymbol("locked"), FieldCodec.flagNode("locked", fresh, FlagStyle.BARE_SYMBOL));
    }

    @Test
    void booleanChildDefaultsWhenAbsent() {
        EncodedValue<Boolean> inBom = FieldCodec.readBool(parse("(symbol)"), "in_bom", true);
        assertTrue(inBom.getValue());
        assertNull(FieldCodec.boolNode("in_bom", inBom));
        assertEquals("(in_bom no)", write(FieldCodec.boolNode("in_bom", inBom.withValue(false))));
    }

    @Test
    void numbers() {
        SList root = parse("(general (thickness 1.6) (version 20240108))");
        EncodedValue<Coord> thickness = FieldCodec.readCoord(root, "thickness", null);
        EncodedValue<Integer> version = FieldCodec.readInt(root, "version", null);

        assertEquals(Coord.fromMm("1.6"), thickness.getValue());
        assertEquals(Integer.valueOf(20240108), version.getValue());
        assertEquals("(thickness 0.8)", write(FieldCodec.coordNode("thickness", thickness.withValue(Coord.fromMm("0.8")))));
        assertEquals("(version 20240109)", write(FieldCodec.intNode("version", version.withValue(20240109))));
    }

    @Test
    void malformedNumberIsAbsent() {
        EncodedValue<Integer> version = FieldCodec.readInt(parse("(x (version abc))"), "version", 7);
        assertFalse(version.isExplicit());
        assertEquals(Integer.valueOf(7), version.getValue());
    }
}
