package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.fidelity.ConsumedNodes;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.common.Position;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.model.pcb.Footprint;
import nl.bytesoflife.deltakicad.model.pcb.Net;
import nl.bytesoflife.deltakicad.model.pcb.Pad;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Footprint and pad mapping, shared by footprint files and the footprints
 * placed on a board.
 */
final class FootprintMapping {

    private FootprintMapping() {
    }

    static boolean isFootprint(SNode node) {
        return node instanceof SList list
                && (list.hasTag(Footprint.TOKEN) || list.hasTag(Footprint.LEGACY_TOKEN));
    }

    /**
     * Reads a footprint. {@code standalone} is true for {@code .kicad_mod}
     * files, whose header (version, generator) is part of the footprint.
     */
    static Footprint readFootprint(SList node, boolean standalone, List<Diagnostic> diagnostics) {
        SAtom nameAtom = node.size() > 1 && node.get(1) instanceof SAtom atom ? atom : null;
        Footprint footprint = new Footprint(nameAtom != null ? nameAtom.text() : "");
        footprint.setToken(node.tag());
        if (nameAtom != null) {
            footprint.setNameField(CommonMapping.readName(nameAtom));
        } else {
            diagnostics.add(Diagnostic.error("Footprint has no name", null));
        }

        ConsumedNodes consumed = new ConsumedNodes();
        if (standalone) {
            CommonMapping.readHeader(node, footprint, consumed);
        } else {
            footprint.setVersionField(EncodedValue.absent(null));
            footprint.setGeneratorField(EncodedValue.absent(null));
        }
        footprint.setLockedField(consumed.mark(FieldCodec.readFlag(node, "locked"), "locked"));
        footprint.setLayerField(consumed.mark(FieldCodec.readText(node, "layer"), "layer"));
        footprint.setUuidField(consumed.mark(FieldCodec.readUuid(node), "uuid"));
        footprint.setDescriptionField(consumed.mark(FieldCodec.readText(node, "descr"), "descr"));
        footprint.setTagsField(consumed.mark(FieldCodec.readText(node, "tags"), "tags"));

        SList at = node.child("at");
        Position position = CommonMapping.readPosition(at);
        if (position != null) {
            consumed.mark(at, "at");
            footprint.setPosition(position);
        } else if (at != null) {
            diagnostics.add(Diagnostic.warning("Footprint " + footprint.getName() + " has a malformed position " + at, null));
        }

        SList attr = consumed.mark(node.child("attr"), "attr");
        if (attr != null) {
            footprint.setAttributes(CommonMapping.texts(attr));
        }

        for (SList child : node.children("property")) {
            Property property = CommonMapping.readProperty(child, diagnostics);
            if (property != null) {
                consumed.mark(child, property);
                footprint.addProperty(property);
            }
        }
        for (SList child : node.children("pad")) {
            Pad pad = readPad(child, diagnostics);
            if (pad != null) {
                consumed.mark(child, pad);
                footprint.addPad(pad);
            }
        }

        footprint.setChildOrder(consumed.capture(node, nameAtom != null ? 1 : 0));
        return footprint;
    }

    static SList footprintNode(Footprint footprint, boolean standalone) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        if (standalone) {
            CommonMapping.putHeader(fields, footprint);
        }
        fields.put("locked", FieldCodec.flagNode("locked", footprint.getLockedField(), FlagStyle.CHILD_NODE));
        fields.put("layer", FieldCodec.textNode("layer", footprint.getLayerField(), AtomStyle.STRING));
        fields.put("uuid", FieldCodec.uuidNode(footprint.getUuidField()));
        fields.put("at", CommonMapping.positionNode(footprint.getPosition()));
        fields.put("descr", FieldCodec.textNode("descr", footprint.getDescriptionField(), AtomStyle.STRING));
        fields.put("tags", FieldCodec.textNode("tags", footprint.getTagsField(), AtomStyle.STRING));
        for (Property property : footprint.getProperties()) {
            fields.put(property, CommonMapping.propertyNode(property));
        }
        fields.put("attr", CommonMapping.keywordsNode("attr", footprint.getAttributes(), AtomStyle.SYMBOL,
                footprint.getChildOrder().sourceOf("attr")));
        for (Pad pad : footprint.getPads()) {
            fields.put(pad, padNode(pad));
        }

        SExpressionBuilder b = SExpressionBuilder.create(footprint.getToken());
        b.addAtom(CommonMapping.nameAtom(footprint.getNameField()));
        footprint.getChildOrder().emit(b, fields);
        return b.build();
    }

    // --- pads ---------------------------------------------------------------

    /** Pad of {@code node}, or null when number, type or shape is missing. */
    static Pad readPad(SList node, List<Diagnostic> diagnostics) {
        if (node.size() < 4 || !(node.get(1) instanceof SAtom number)
                || !(node.get(2) instanceof SSymbol type) || !(node.get(3) instanceof SSymbol shape)) {
            diagnostics.add(Diagnostic.warning("Pad without number, type and shape kept unmodeled: " + node, null));
            return null;
        }
        Pad pad = new Pad(number.text(), type.value(), shape.value());
        pad.setNumberField(CommonMapping.readName(number));
        ConsumedNodes consumed = new ConsumedNodes();

        SList at = node.child("at");
        Position position = CommonMapping.readPosition(at);
        if (position != null) {
            consumed.mark(at, "at");
            pad.setPosition(position);
        } else {
            diagnostics.add(Diagnostic.warning("Pad " + number.text() + " has no usable position", null));
        }

        SList sizeNode = node.child("size");
        CoordPoint size = CommonMapping.readPoint(sizeNode);
        if (size != null) {
            consumed.mark(sizeNode, "size");
            pad.setSize(size);
        }

        pad.setDrillField(consumed.mark(readDrill(node.child("drill")), "drill"));

        SList layers = node.child("layers");
        if (layers != null && layers.atom(0) != null) {
            consumed.mark(layers, "layers");
            pad.setLayers(CommonMapping.texts(layers));
            pad.setLayerStyle(AtomStyle.of(layers.atom(0)));
        }

        SList net = node.child("net");
        if (net != null && net.getInt(0) != null && net.getInt(0) >= 0) {
            consumed.mark(net, "net");
            pad.setNet(new Net(net.getInt(0), net.getString(1) != null ? net.getString(1) : ""));
        }

        pad.setUuidField(consumed.mark(FieldCodec.readUuid(node), "uuid"));
        pad.setChildOrder(consumed.capture(node, 3));
        return pad;
    }

    /** Diameter of {@code (drill [oval] d [w] ...)}; the node is kept as read while unchanged. */
    private static EncodedValue<Coord> readDrill(SList drill) {
        if (drill == null) {
            return EncodedValue.absent(null);
        }
        List<SAtom> atoms = drill.atoms();
        for (int i = 0; i < atoms.size(); i++) {
            if (atoms.get(i) instanceof SNumber) {
                Coord diameter = drill.getCoord(i);
                return diameter != null ? EncodedValue.read(diameter, drill) : EncodedValue.absent(null);
            }
        }
        return EncodedValue.absent(null);
    }

    /**
     * {@code (drill ...)} for a changed diameter: the first number of the
     * node it was read from is replaced, so an oval shape, the slot width and
     * the offset stay as they were.
     */
    private static SNode drillNode(EncodedValue<Coord> drill, SNode source) {
        if (drill.isParsed() || drill.getValue() == null || !(source instanceof SList list)) {
            return FieldCodec.coordNode("drill", drill);
        }
        SExpressionBuilder b = SExpressionBuilder.create("drill");
        boolean replaced = false;
        for (int i = 1; i < list.size(); i++) {
            SNode child = list.get(i);
            if (!replaced && child instanceof SNumber) {
                b.addMm(drill.getValue());
                replaced = true;
            } else {
                b.addChild(child);
            }
        }
        return b.layoutFrom(list).build();
    }

    static SList padNode(Pad pad) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("at", CommonMapping.positionNode(pad.getPosition()));
        fields.put("size", CommonMapping.pointNode("size", pad.getSize()));
        fields.put("drill", drillNode(pad.getDrillField(), pad.getChildOrder().sourceOf("drill")));
        if (!pad.getLayers().isEmpty()) {
            AtomStyle style = pad.getLayerStyle() != null ? pad.getLayerStyle() : AtomStyle.STRING;
            fields.put("layers", CommonMapping.keywordsNode("layers", pad.getLayers(), style,
                    pad.getChildOrder().sourceOf("layers")));
        }
        if (pad.getNet() != null) {
            fields.put("net", SExpressionBuilder.create("net")
                    .addValue(pad.getNet().number())
                    .addValue(pad.getNet().name())
                    .build());
        }
        fields.put("uuid", FieldCodec.uuidNode(pad.getUuidField()));

        SExpressionBuilder b = SExpressionBuilder.create("pad")
                .addAtom(CommonMapping.nameAtom(pad.getNumberField()))
                .addSymbol(pad.getType())
                .addSymbol(pad.getShape());
        pad.getChildOrder().emit(b, fields);
        return b.build();
    }
}
