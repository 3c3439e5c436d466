package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.model.sch.LibSymbol;
import nl.bytesoflife.deltakicad.model.sch.Schematic;
import nl.bytesoflife.deltakicad.model.sch.SchematicSymbol;
import nl.bytesoflife.deltakicad.model.sch.Wire;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.LinkedHashMap;
import java.util.Map;

/** Writes {@code .kicad_sch} schematics. */
public class SchematicWriter extends DocumentWriter<Schematic> {

    @Override
    public SList toTree(Schematic schematic) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        CommonMapping.putHeader(fields, schematic);
        fields.put("uuid", FieldCodec.uuidNode(schematic.getUuidField()));
        fields.put("paper", FieldCodec.textNode("paper", schematic.getPaperField(), AtomStyle.STRING));
        fields.put("lib_symbols", libSymbolsNode(schematic));
        for (Wire wire : schematic.getWires()) {
            fields.put(wire, wireNode(wire));
        }
        for (SchematicSymbol symbol : schematic.getSymbols()) {
            fields.put(symbol, symbolNode(symbol));
        }

        SExpressionBuilder b = SExpressionBuilder.create(Schematic.TOKEN);
        schematic.getChildOrder().emit(b, fields);
        return b.build();
    }

    private static SList libSymbolsNode(Schematic schematic) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        for (LibSymbol symbol : schematic.getLibSymbols()) {
            fields.put(symbol, SymbolMapping.libSymbolNode(symbol));
        }
        SExpressionBuilder b = SExpressionBuilder.create("lib_symbols");
        schematic.getLibSymbolsOrder().emit(b, fields);
        return b.build();
    }

    private static SList symbolNode(SchematicSymbol symbol) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("lib_id", FieldCodec.textNode("lib_id", symbol.getLibIdField(), AtomStyle.STRING));
        fields.put("at", CommonMapping.positionNode(symbol.getPosition()));
        fields.put("unit", FieldCodec.intNode("unit", symbol.getUnitField()));
        fields.put("in_bom", FieldCodec.boolNode("in_bom", symbol.getInBomField()));
        fields.put("on_board", FieldCodec.boolNode("on_board", symbol.getOnBoardField()));
        fields.put("uuid", FieldCodec.uuidNode(symbol.getUuidField()));
        for (Property property : symbol.getProperties()) {
            fields.put(property, CommonMapping.propertyNode(property));
        }

        SExpressionBuilder b = SExpressionBuilder.create("symbol");
        symbol.getChildOrder().emit(b, fields);
        return b.build();
    }

    private static SList wireNode(Wire wire) {
        SExpressionBuilder pts = SExpressionBuilder.create("pts");
        for (CoordPoint point : wire.getPoints()) {
            pts.addChild(CommonMapping.pointNode("xy", point));
        }
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("pts", pts.build());
        fields.put("uuid", FieldCodec.uuidNode(wire.getUuidField()));

        SExpressionBuilder b = SExpressionBuilder.create("wire");
        wire.getChildOrder().emit(b, fields);
        return b.build();
    }
}
