package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.ConsumedNodes;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.common.Position;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.model.sch.LibSymbol;
import nl.bytesoflife.deltakicad.model.sch.Schematic;
import nl.bytesoflife.deltakicad.model.sch.SchematicSymbol;
import nl.bytesoflife.deltakicad.model.sch.Wire;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.List;

/** Reads {@code .kicad_sch} schematics. */
public class SchematicReader extends DocumentReader<Schematic> {

    @Override
    protected String kind() {
        return "schematic";
    }

    @Override
    protected boolean acceptsRoot(String tag) {
        return Schematic.TOKEN.equals(tag);
    }

    @Override
    protected Schematic map(SList root, List<Diagnostic> diagnostics) {
        Schematic schematic = new Schematic();
        ConsumedNodes consumed = new ConsumedNodes();
        CommonMapping.readHeader(root, schematic, consumed);
        FlagStyle hideStyle = CommonMapping.effectsHideStyle(schematic);
        schematic.setUuidField(consumed.mark(FieldCodec.readUuid(root), "uuid"));
        schematic.setPaperField(consumed.mark(FieldCodec.readText(root, "paper"), "paper"));

        SList libSymbols = consumed.mark(root.child("lib_symbols"), "lib_symbols");
        if (libSymbols != null) {
            ConsumedNodes libConsumed = new ConsumedNodes();
            for (SList child : libSymbols.children("symbol")) {
                LibSymbol symbol = SymbolMapping.readLibSymbol(child, hideStyle, diagnostics);
                if (symbol != null) {
                    libConsumed.mark(child, symbol);
                    schematic.addLibSymbol(symbol);
                }
            }
            schematic.setLibSymbolsOrder(libConsumed.capture(libSymbols, 0));
        }

        for (SNode child : root.children()) {
            if (child instanceof SList list && list.hasTag("symbol")) {
                SchematicSymbol symbol = readSymbol(list, hideStyle, diagnostics);
                if (symbol != null) {
                    consumed.mark(list, symbol);
                    schematic.addSymbol(symbol);
                }
            } else if (child instanceof SList list && list.hasTag("wire")) {
                Wire wire = readWire(list, diagnostics);
                if (wire != null) {
                    consumed.mark(list, wire);
                    schematic.addWire(wire);
                }
            }
        }

        schematic.setChildOrder(consumed.capture(root, 0));
        return schematic;
    }

    private static SchematicSymbol readSymbol(SList node, FlagStyle hideStyle, List<Diagnostic> diagnostics) {
        EncodedValue<String> libId = FieldCodec.readText(node, "lib_id");
        if (libId.getValue() == null) {
            diagnostics.add(Diagnostic.error("Placed symbol has no lib_id", null));
            return null;
        }
        SchematicSymbol symbol = new SchematicSymbol(libId.getValue());
        ConsumedNodes consumed = new ConsumedNodes();
        symbol.setLibIdField(consumed.mark(libId, "lib_id"));

        SList at = node.child("at");
        Position position = CommonMapping.readPosition(at);
        if (position != null) {
            consumed.mark(at, "at");
            symbol.setPosition(position);
        }
        symbol.setUnitField(consumed.mark(FieldCodec.readInt(node, "unit", 1), "unit"));
        symbol.setInBomField(consumed.mark(FieldCodec.readBool(node, "in_bom", true), "in_bom"));
        symbol.setOnBoardField(consumed.mark(FieldCodec.readBool(node, "on_board", true), "on_board"));
        symbol.setUuidField(consumed.mark(FieldCodec.readUuid(node), "uuid"));

        for (SList child : node.children("property")) {
            Property property = CommonMapping.readProperty(child, diagnostics);
            if (property != null) {
                property.setEffectsHideStyle(hideStyle);
                consumed.mark(child, property);
                symbol.addProperty(property);
            }
        }

        symbol.setChildOrder(consumed.capture(node, 0));
        return symbol;
    }

    private static Wire readWire(SList node, List<Diagnostic> diagnostics) {
        SList pts = node.child("pts");
        if (pts == null) {
            diagnostics.add(Diagnostic.warning("Wire without points kept unmodeled", null));
            return null;
        }
        List<CoordPoint> points = new ArrayList<>();
        for (int i = 1; i < pts.size(); i++) {
            CoordPoint point = pts.get(i) instanceof SList xy && xy.hasTag("xy") ? CommonMapping.readPoint(xy) : null;
            if (point == null) {
                diagnostics.add(Diagnostic.warning("Wire with malformed points kept unmodeled: " + pts, null));
                return null;
            }
            points.add(point);
        }

        Wire wire = new Wire();
        ConsumedNodes consumed = new ConsumedNodes();
        consumed.mark(pts, "pts");
        wire.setPoints(points);
        wire.setUuidField(consumed.mark(FieldCodec.readUuid(node), "uuid"));
        wire.setChildOrder(consumed.capture(node, 0));
        return wire;
    }
}
