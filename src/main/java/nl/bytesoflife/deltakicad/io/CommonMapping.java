package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.fidelity.ConsumedNodes;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FieldCodec;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.KiCadDocument;
import nl.bytesoflife.deltakicad.model.common.Position;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.model.common.TextEffects;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping of the pieces shared by all document kinds: positions, points,
 * text effects, properties and the document header.
 */
final class CommonMapping {

    private CommonMapping() {
    }

    // --- (at x y [angle]) ---------------------------------------------------

    /** Position of {@code (at x y [angle])}, or null when the node has another shape. */
    static Position readPosition(SList at) {
        if (at == null) {
            return null;
        }
        List<SAtom> atoms = at.atoms();
        if (atoms.size() < 2 || atoms.size() > 3 || at.size() != atoms.size() + 1) {
            return null;
        }
        for (SAtom atom : atoms) {
            if (!(atom instanceof SNumber)) {
                return null;
            }
        }
        Coord x = at.getCoord(0);
        Coord y = at.getCoord(1);
        if (x == null || y == null) {
            return null;
        }
        Double angle = atoms.size() == 3 ? at.getDouble(2) : null;
        return new Position(x, y, angle);
    }

    static SList positionNode(Position position) {
        if (position == null) {
            return null;
        }
        SExpressionBuilder b = SExpressionBuilder.create("at")
                .addMm(position.x())
                .addMm(position.y());
        if (position.angle() != null) {
            b.addValue(position.angle());
        }
        return b.build();
    }

    // --- (tag x y) points ---------------------------------------------------

    static CoordPoint readPoint(SList node) {
        if (node == null || node.size() != 3 || node.getCoord(0) == null || node.getCoord(1) == null) {
            return null;
        }
        return new CoordPoint(node.getCoord(0), node.getCoord(1));
    }

    static SList pointNode(String tag, CoordPoint point) {
        if (point == null) {
            return null;
        }
        return SExpressionBuilder.create(tag).addMm(point.x()).addMm(point.y()).build();
    }

    // --- (effects ...) ------------------------------------------------------

    static TextEffects readEffects(SList node) {
        TextEffects effects = new TextEffects();
        ConsumedNodes consumed = new ConsumedNodes();

        SList font = consumed.mark(node.child("font"), "font");
        if (font != null) {
            ConsumedNodes fontConsumed = new ConsumedNodes();
            CoordPoint size = readPoint(font.child("size"));
            if (size != null) {
                fontConsumed.mark(font.child("size"), "size");
            }
            effects.setFontSize(size);
            effects.setThicknessField(fontConsumed.mark(FieldCodec.readCoord(font, "thickness", null), "thickness"));
            effects.setBoldField(fontConsumed.mark(FieldCodec.readFlag(font, "bold"), "bold"));
            effects.setItalicField(fontConsumed.mark(FieldCodec.readFlag(font, "italic"), "italic"));
            effects.setFontOrder(fontConsumed.capture(font, 0));
        } else {
            effects.setFontSize(null);
        }

        SList justify = consumed.mark(node.child("justify"), "justify");
        if (justify != null) {
            effects.setJustify(texts(justify));
        }

        effects.setHideField(consumed.mark(FieldCodec.readFlag(node, "hide"), "hide"));
        effects.setChildOrder(consumed.capture(node, 0));
        return effects;
    }

    static SList effectsNode(TextEffects effects) {
        if (effects == null) {
            return null;
        }
        Map<Object, SNode> fontFields = new LinkedHashMap<>();
        fontFields.put("size", pointNode("size", effects.getFontSize()));
        fontFields.put("thickness", FieldCodec.coordNode("thickness", effects.getThicknessField()));
        fontFields.put("bold", FieldCodec.flagNode("bold", effects.getBoldField(), FlagStyle.CHILD_NODE));
        fontFields.put("italic", FieldCodec.flagNode("italic", effects.getItalicField(), FlagStyle.CHILD_NODE));

        SList font = null;
        if (effects.getFontOrder().getSource() != null || fontFields.values().stream().anyMatch(n -> n != null)) {
            SExpressionBuilder fb = SExpressionBuilder.create("font");
            effects.getFontOrder().emit(fb, fontFields);
            font = fb.build();
        }

        SList justify = keywordsNode("justify", effects.getJustify(), AtomStyle.SYMBOL,
                effects.getChildOrder().sourceOf("justify"));

        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("font", font);
        fields.put("justify", justify);
        fields.put("hide", FieldCodec.flagNode("hide", effects.getHideField(), FlagStyle.CHILD_NODE));

        SExpressionBuilder b = SExpressionBuilder.create("effects");
        effects.getChildOrder().emit(b, fields);
        return b.build();
    }

    // --- (property "Key" "Value" ...) ---------------------------------------

    /** Property of {@code node}, or null when it lacks a key or value. */
    static Property readProperty(SList node, List<Diagnostic> diagnostics) {
        String key = node.getString(0);
        String value = node.getString(1);
        if (key == null || value == null || node.atom(0) != node.get(1) || node.atom(1) != node.get(2)) {
            diagnostics.add(Diagnostic.warning("Property without key and value kept unmodeled: " + node, null));
            return null;
        }
        Property property = new Property(key, value);
        ConsumedNodes consumed = new ConsumedNodes();

        SList at = node.child("at");
        Position position = readPosition(at);
        if (position != null) {
            consumed.mark(at, "at");
            property.setPosition(position);
        }
        property.setLayerField(consumed.mark(FieldCodec.readText(node, "layer"), "layer"));
        property.setUuidField(consumed.mark(FieldCodec.readUuid(node), "uuid"));
        property.setHideField(consumed.mark(FieldCodec.readFlag(node, "hide"), "hide"));
        SList effects = consumed.mark(node.child("effects"), "effects");
        if (effects != null) {
            property.setEffects(readEffects(effects));
        }
        property.setChildOrder(consumed.capture(node, 2));
        return property;
    }

    static SList propertyNode(Property property) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        fields.put("at", positionNode(property.getPosition()));
        fields.put("layer", FieldCodec.textNode("layer", property.getLayerField(), AtomStyle.STRING));
        fields.put("hide", FieldCodec.flagNode("hide", property.getHideField(), FlagStyle.CHILD_NODE));
        fields.put("uuid", FieldCodec.uuidNode(property.getUuidField()));
        fields.put("effects", effectsNode(property.getEffects()));

        SList source = property.getChildOrder().getSource();
        SExpressionBuilder b = SExpressionBuilder.create("property")
                .addAtom(keepAtom(source, 0, property.getKey()))
                .addAtom(keepAtom(source, 1, property.getValue()));
        property.getChildOrder().emit(b, fields);
        return b.build();
    }

    // --- document header ----------------------------------------------------

    /** First schematic and symbol library version that writes flags as {@code (hide yes)}. */
    static final int YES_NO_FLAGS_VERSION = 20231120;

    /** Spelling of hide flags added to schematic and symbol properties of {@code document}. */
    static FlagStyle effectsHideStyle(KiCadDocument document) {
        Integer version = document.getVersion();
        return version != null && version < YES_NO_FLAGS_VERSION ? FlagStyle.BARE_SYMBOL : FlagStyle.CHILD_NODE;
    }

    /** Reads {@code version}, {@code generator} and {@code generator_version}. */
    static void readHeader(SList root, KiCadDocument document, ConsumedNodes consumed) {
        document.setVersionField(consumed.mark(FieldCodec.readInt(root, "version", null), "version"));
        document.setGeneratorField(consumed.mark(FieldCodec.readText(root, "generator"), "generator"));
        document.setGeneratorVersionField(
                consumed.mark(FieldCodec.readText(root, "generator_version"), "generator_version"));
    }

    static void putHeader(Map<Object, SNode> fields, KiCadDocument document) {
        fields.put("version", FieldCodec.intNode("version", document.getVersionField()));
        fields.put("generator", FieldCodec.textNode("generator", document.getGeneratorField(), AtomStyle.STRING));
        fields.put("generator_version",
                FieldCodec.textNode("generator_version", document.getGeneratorVersionField(), AtomStyle.STRING));
    }

    /** Leading value {@code atom} of an element, as an encoded name. */
    static EncodedValue<String> readName(SAtom atom) {
        return EncodedValue.read(atom.text(), atom).withAtomStyle(AtomStyle.of(atom));
    }

    static SAtom nameAtom(EncodedValue<String> name) {
        if (name.isParsed() && name.getSource() instanceof SAtom atom) {
            return atom;
        }
        return name.atomStyleOr(AtomStyle.STRING).toAtom(name.getValue() != null ? name.getValue() : "");
    }

    /**
     * {@code (tag v1 v2 ...)} for a keyword list such as layers or
     * attributes. The source node is reused while its values read the same,
     * so mixed quoting survives.
     */
    static SList keywordsNode(String tag, List<String> values, AtomStyle style, SNode source) {
        if (values == null) {
            return null;
        }
        if (source instanceof SList list && texts(list).equals(values)) {
            return list;
        }
        SExpressionBuilder b = SExpressionBuilder.create(tag);
        for (String value : values) {
            b.addAtom(style.toAtom(value));
        }
        return b.build();
    }

    static List<String> texts(SList node) {
        List<String> texts = new ArrayList<>();
        for (SAtom atom : node.atoms()) {
            texts.add(atom.text());
        }
        return texts;
    }

    /** The source atom at {@code index} when it still reads {@code text}, else a quoted string. */
    static SAtom keepAtom(SList source, int index, String text) {
        SAtom atom = source != null ? source.atom(index) : null;
        return atom != null && atom.text().equals(text) ? atom : new SString(text);
    }
}
