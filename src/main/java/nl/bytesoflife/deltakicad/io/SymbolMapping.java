package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.fidelity.ChildOrder;
import nl.bytesoflife.deltakicad.fidelity.ConsumedNodes;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.model.sch.LibSymbol;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Library symbol mapping, shared by symbol libraries and the
 * {@code lib_symbols} section of schematics.
 */
final class SymbolMapping {

    private SymbolMapping() {
    }

    /**
     * Symbol of {@code node}, or null when it has no name. {@code hideStyle}
     * is how the file's era spells a hide flag added to a property later.
     */
    static LibSymbol readLibSymbol(SList node, FlagStyle hideStyle, List<Diagnostic> diagnostics) {
        if (node.size() < 2 || !(node.get(1) instanceof SAtom name)) {
            diagnostics.add(Diagnostic.warning("Symbol without a name kept unmodeled", null));
            return null;
        }
        LibSymbol symbol = new LibSymbol(name.text());
        symbol.setNameField(CommonMapping.readName(name));
        ConsumedNodes consumed = new ConsumedNodes();

        symbol.setExtendsField(consumed.mark(FieldCodec.readText(node, "extends"), "extends"));

        SList pinNumbers = consumed.mark(node.child("pin_numbers"), "pin_numbers");
        if (pinNumbers != null) {
            ConsumedNodes pinConsumed = new ConsumedNodes();
            symbol.setPinNumbersHideField(pinConsumed.mark(FieldCodec.readFlag(pinNumbers, "hide"), "hide"));
            symbol.setPinNumbersOrder(pinConsumed.capture(pinNumbers, 0));
        }

        SList pinNames = consumed.mark(node.child("pin_names"), "pin_names");
        if (pinNames != null) {
            ConsumedNodes pinConsumed = new ConsumedNodes();
            symbol.setPinNamesOffsetField(pinConsumed.mark(FieldCodec.readCoord(pinNames, "offset", null), "offset"));
            symbol.setPinNamesHideField(pinConsumed.mark(FieldCodec.readFlag(pinNames, "hide"), "hide"));
            symbol.setPinNamesOrder(pinConsumed.capture(pinNames, 0));
        }

        symbol.setExcludeFromSimField(
                consumed.mark(FieldCodec.readBool(node, "exclude_from_sim", false), "exclude_from_sim"));
        symbol.setInBomField(consumed.mark(FieldCodec.readBool(node, "in_bom", true), "in_bom"));
        symbol.setOnBoardField(consumed.mark(FieldCodec.readBool(node, "on_board", true), "on_board"));

        for (SList child : node.children("property")) {
            Property property = CommonMapping.readProperty(child, diagnostics);
            if (property != null) {
                property.setEffectsHideStyle(hideStyle);
                consumed.mark(child, property);
                symbol.addProperty(property);
            }
        }

        symbol.setChildOrder(consumed.capture(node, 1));
        return symbol;
    }

    static SList libSymbolNode(LibSymbol symbol) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("extends", FieldCodec.textNode("extends", symbol.getExtendsField(), AtomStyle.STRING));
        fields.put("pin_numbers", pinOptionsNode("pin_numbers", symbol.getPinNumbersOrder(),
                null, symbol.getPinNumbersHideField()));
        fields.put("pin_names", pinOptionsNode("pin_names", symbol.getPinNamesOrder(),
                symbol.getPinNamesOffsetField(), symbol.getPinNamesHideField()));
        fields.put("exclude_from_sim", FieldCodec.boolNode("exclude_from_sim", symbol.getExcludeFromSimField()));
        fields.put("in_bom", FieldCodec.boolNode("in_bom", symbol.getInBomField()));
        fields.put("on_board", FieldCodec.boolNode("on_board", symbol.getOnBoardField()));
        for (Property property : symbol.getProperties()) {
            fields.put(property, CommonMapping.propertyNode(property));
        }

        SExpressionBuilder b = SExpressionBuilder.create("symbol")
                .addAtom(CommonMapping.nameAtom(symbol.getNameField()));
        symbol.getChildOrder().emit(b, fields);
        return b.build();
    }

    /**
     * {@code (pin_names (offset o) hide)} or {@code (pin_numbers hide)}; null
     * when nothing would be left inside.
     */
    private static SList pinOptionsNode(String tag, ChildOrder order, EncodedValue<Coord> offset,
                                        EncodedValue<Boolean> hide) {
        SNode offsetNode = FieldCodec.coordNode("offset", offset);
        SNode hideNode = FieldCodec.flagNode("hide", hide, FlagStyle.CHILD_NODE);
        if (order.getSource() == null && offsetNode == null && hideNode == null) {
            return null;
        }
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("offset", offsetNode);
        fields.put("hide", hideNode);
        SExpressionBuilder b = SExpressionBuilder.create(tag);
        order.emit(b, fields);
        return b.size() > 1 ? b.build() : null;
    }
}
