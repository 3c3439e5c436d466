package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.common.Position;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.model.pcb.Footprint;
import nl.bytesoflife.deltakicad.model.pcb.Pad;
import nl.bytesoflife.deltakicad.sexpr.SExpressionFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class FootprintReaderTest {

    private final FootprintReader reader = new FootprintReader();
    private final FootprintWriter writer = new FootprintWriter();

    @Test
    void readKiCad7Footprint() throws KiCadFileException {
        Footprint footprint = reader.read(Fixtures.text("R_0603_v7.kicad_mod"));

        assertTrue(footprint.getDiagnostics().isEmpty());
        assertEquals(SExpressionFormat.KICAD_LEGACY, footprint.getFormat());
        assertEquals("R_0603_1608Metric", footprint.getName());
        assertEquals(Integer.valueOf(20221018), footprint.getVersion());
        assertEquals("pcbnew", footprint.getGenerator());
        assertEquals(AtomStyle.SYMBOL, footprint.getGeneratorField().getAtomStyle());
        assertEquals("F.Cu", footprint.getLayer());
        assertEquals("Resistor SMD 0603 (1608 Metric)", footprint.getDescription());
        assertEquals("resistor", footprint.getTags());
        assertEquals(List.of("smd"), footprint.getAttributes());
        assertFalse(footprint.isLocked());

        assertEquals(2, footprint.getPads().size());
        Pad pad = footprint.getPads().get(0);
        assertEquals("1", pad.getNumber());
        assertEquals("smd", pad.getType());
        assertEquals("roundrect", pad.getShape());
        assertEquals(Position.of(Coord.fromMm("-0.825"), Coord.ZERO), pad.getPosition());
        assertEquals(CoordPoint.ofMm(0.8, 0.95), pad.getSize());
        assertEquals(List.of("F.Cu", "F.Paste", "F.Mask"), pad.getLayers());
        assertEquals("8b8a0e5c-1d2f-4a3b-9c4d-5e6f7a8b9c0d", pad.getUuid());
        assertEquals("tstamp", pad.getUuidField().getTokenName());
        assertFalse(pad.isThroughHole());

        // fp_text, fp_line and the 3D model are kept verbatim
        assertEquals(4, footprint.getUnmodeled().size());
    }

    @Test
    void readKiCad8Footprint() throws KiCadFileException {
        Footprint footprint = reader.read(Fixtures.text("R_0603_v8.kicad_mod"));

        assertEquals(SExpressionFormat.KICAD_CURRENT, footprint.getFormat());
        assertEquals("pcbnew", footprint.getGenerator());
        assertEquals(AtomStyle.STRING, footprint.getGeneratorField().getAtomStyle());
        assertEquals("8.0", footprint.getGeneratorVersion());
        assertEquals(3, footprint.getProperties().size());
        assertEquals("REF**", footprint.getReference());

        Property reference = footprint.getProperty("Reference");
        assertEquals("F.SilkS", reference.getLayer());
        assertEquals(Coord.fromMm("-1.43"), reference.getPosition().y());
        assertEquals(Coord.fromMm("0.15"), reference.getEffects().getThickness());
        assertFalse(reference.isHidden());
        assertTrue(footprint.getProperty("Datasheet").isHidden());
        assertEquals(2, footprint.getPads().size());
    }

    @Test
    void readPreKiCad6Module() throws KiCadFileException {
        Footprint footprint = reader.read(Fixtures.text("R_0603_legacy.kicad_mod"));

        assertEquals(Footprint.LEGACY_TOKEN, footprint.getToken());
        assertEquals("R_0603", footprint.getName());
        assertNull(footprint.getVersion());
        assertEquals("resistor", footprint.getTags());
        Pad pad = footprint.getPads().get(1);
        assertEquals("2", pad.getNumber());
        assertEquals(AtomStyle.SYMBOL, pad.getLayerStyle());
        assertEquals(Coord.fromMm("0.7875"), pad.getPosition().x());
    }

    @Test
    void movedPadChangesOnlyItsPosition() throws KiCadFileException {
        String text = Fixtures.text("R_0603_v7.kicad_mod");
        Footprint footprint = reader.read(text);

        Pad pad = footprint.getPads().get(0);
        pad.setPosition(pad.getPosition().movedBy(Coord.fromMm("-0.075"), Coord.ZERO));

        assertEquals(text.replace("(at -0.825 0)", "(at -0.9 0)"), writer.write(footprint));
    }

    @Test
    void renamedModuleKeepsBareSpelling() throws KiCadFileException {
        String text = Fixtures.text("R_0603_legacy.kicad_mod");
        Footprint footprint = reader.read(text);

        footprint.setName("R_0805");

        assertEquals(text.replace("(module R_0603 ", "(module R_0805 "), writer.write(footprint));
    }

    @Test
    void newPadGoesAfterExistingPads() throws KiCadFileException {
        String text = Fixtures.text("R_0603_v8.kicad_mod");
        Footprint footprint = reader.read(text);

        Pad pad = new Pad("3", "smd", "rect");
        pad.setPosition(Position.of(Coord.ZERO, Coord.fromMm(2)));
        pad.setSize(CoordPoint.ofMm(1, 1));
        pad.setLayers(List.of("F.Cu"));
        footprint.addPad(pad);

        String expected = text.replace("\t(model ",
                "\t(pad \"3\" smd rect\n\t\t(at 0 2)\n\t\t(size 1 1)\n\t\t(layers \"F.Cu\")\n\t)\n\t(model ");
        assertEquals(expected, writer.write(footprint));
    }

    @Test
    void newPropertyGoesAfterExistingProperties() throws KiCadFileException {
        String text = Fixtures.text("R_0603_v8.kicad_mod");
        Footprint footprint = reader.read(text);

        footprint.addProperty(new Property("MPN", "RC0603FR-0710KL"));

        String expected = text.replace("\t(attr smd)", "\t(property \"MPN\" \"RC0603FR-0710KL\")\n\t(attr smd)");
        assertEquals(expected, writer.write(footprint));
    }

    @Test
    void hidingPropertyAgainRestoresOriginal() throws KiCadFileException {
        String text = Fixtures.text("R_0603_v8.kicad_mod");
        Footprint footprint = reader.read(text);
        Property datasheet = footprint.getProperty("Datasheet");

        datasheet.setHidden(false);
        assertEquals(text.replace("\t\t(hide yes)\n", ""), writer.write(footprint));

        datasheet.setHidden(true);
        assertEquals(text, writer.write(footprint));
    }

    @Test
    void footprintBuiltInMemoryUsesCurrentFormat() {
        Footprint footprint = new Footprint("Test");
        Pad pad = new Pad("1", "smd", "rect");
        pad.setPosition(Position.ORIGIN);
        pad.setSize(CoordPoint.ofMm(1, 1));
        pad.setLayers(List.of("F.Cu"));
        footprint.addPad(pad);

        String expected = """
                (footprint "Test"
                \t(version 20240108)
                \t(generator "delta_kicad")
                \t(layer "F.Cu")
                \t(pad "1" smd rect
                \t\t(at 0 0)
                \t\t(size 1 1)
                \t\t(layers "F.Cu")
                \t)
                )
                """;
        assertEquals(expected, writer.write(footprint));
    }

    @Test
    void truncatedFileKeepsWhatWasRead() throws KiCadFileException {
        String text = Fixtures.text("R_0603_v8.kicad_mod");
        Footprint footprint = reader.read(text.substring(0, text.indexOf("\t(model ")));

        assertTrue(footprint.hasErrors());
        assertEquals(2, footprint.getPads().size());
        assertEquals("R_0603_1608Metric", footprint.getName());
    }

    @Test
    void ovalDrillKeepsShapeAndOffsetWhenResized() throws KiCadFileException {
        String text = "(footprint \"X\" (layer \"F.Cu\") (pad \"1\" thru_hole oval (at 0 0) (size 1.5 2.5)"
                + " (drill oval 0.8 1.6 (offset 0.1 0)) (layers \"*.Cu\" \"*.Mask\")))";
        Footprint footprint = reader.read(text);
        Pad pad = footprint.getPads().get(0);
        assertEquals(Coord.fromMm("0.8"), pad.getDrill());

        pad.setDrill(Coord.fromMm("0.9"));

        assertEquals(text.replace("(drill oval 0.8 1.6", "(drill oval 0.9 1.6") + "\n", writer.write(footprint));
    }

    @Test
    void positionTooLargeForNanometersIsAWarning() throws KiCadFileException {
        String text = "(footprint \"X\" (layer \"F.Cu\") (at 99999999999999 0)"
                + " (pad \"1\" smd rect (at 99999999999999 0) (size 1 1) (layers \"F.Cu\")))";
        Footprint footprint = reader.read(text);

        assertFalse(footprint.hasErrors());
        assertEquals(2, footprint.getWarnings().size());
        assertNull(footprint.getPosition());
        assertEquals(1, footprint.getPads().size());
        assertNull(footprint.getPads().get(0).getPosition());
        assertEquals(text + "\n", writer.write(footprint));
    }

    @Test
    void padWithoutTypeIsKeptVerbatim() throws KiCadFileException {
        String text = "(footprint \"X\" (layer \"F.Cu\") (pad \"1\"))";
        Footprint footprint = reader.read(text);

        assertTrue(footprint.getPads().isEmpty());
        assertFalse(footprint.getWarnings().isEmpty());
        assertFalse(footprint.hasErrors());
        assertEquals(text + "\n", writer.write(footprint));
    }

    @Test
    void footprintWithoutNameIsAnError() throws KiCadFileException {
        Footprint footprint = reader.read("(footprint (layer \"F.Cu\"))");
        assertTrue(footprint.hasErrors());
    }

    @Test
    void wrongRootIsRejected() {
        KiCadFileException e = assertThrows(KiCadFileException.class,
                () -> reader.read("(kicad_pcb (version 20240108))"));
        assertTrue(e.getMessage().contains("kicad_pcb"));
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(KiCadFileException.class, () -> reader.read(""));
    }

    @Test
    void fileErrorsNameThePath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("board.kicad_mod");
        Files.writeString(file, "(kicad_sch (version 20231120))");

        KiCadFileException e = assertThrows(KiCadFileException.class, () -> reader.read(file));
        assertEquals(file, e.getFilePath());

        KiCadFileException missing = assertThrows(KiCadFileException.class, () -> reader.read(dir.resolve("none")));
        assertNotNull(missing.getCause());
    }

    @Test
    void readAsync() {
        Footprint footprint = reader.readAsync(Fixtures.open("R_0603_v8.kicad_mod"), Runnable::run).join();
        assertEquals("R_0603_1608Metric", footprint.getName());

        ByteArrayInputStream bad = new ByteArrayInputStream("(kicad_pcb)".getBytes(StandardCharsets.UTF_8));
        CompletionException e = assertThrows(CompletionException.class,
                () -> reader.readAsync(bad, Runnable::run).join());
        assertInstanceOf(KiCadFileException.class, e.getCause());
    }

    @Test
    void writeAsyncProducesSameText() throws KiCadFileException {
        String text = Fixtures.text("R_0603_v8.kicad_mod");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.writeAsync(reader.read(text), out, Runnable::run).join();

        assertEquals(text, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void writeToFileAndBack(@TempDir Path dir) throws Exception {
        String text = Fixtures.text("R_0603_v7.kicad_mod");
        Path file = dir.resolve("R_0603.kicad_mod");

        writer.write(reader.read(text), file);

        assertEquals(text, Files.readString(file));
        assertEquals(2, reader.read(file).getPads().size());
    }

    @Test
    void boundingBoxCoversPads() throws KiCadFileException {
        Footprint footprint = reader.read(Fixtures.text("R_0603_v8.kicad_mod"));
        assertEquals(Coord.fromMm("-1.225"), footprint.getBoundingBox().getMinX());
        assertEquals(Coord.fromMm("1.225"), footprint.getBoundingBox().getMaxX());
        assertEquals(Coord.fromMm("0.95"), footprint.getBoundingBox().getHeight());
    }
}
