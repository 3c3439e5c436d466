package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;

/**
 * Reads single-valued fields into {@link EncodedValue}s and turns them back
 * into nodes using the recorded encoding.
 * <p>
 * Readers return {@code absent(default)} when the field is missing. Writers
 * return the node a value was read from while the value is unchanged, and
 * null for fields that should not be written.
 */
public final class FieldCodec {

    public static final String UUID = "uuid";
    public static final String TSTAMP = "tstamp";

    private FieldCodec() {
    }

    // --- text ---------------------------------------------------------------

    /**
     * Reads {@code (tag value)}, trying each legacy token name in turn when
     * {@code tag} is missing.
     */
    public static EncodedValue<String> readText(SList parent, String tag, String... legacyTags) {
        SList child = findChild(parent, tag, legacyTags);
        if (child == null || child.atom(0) == null) {
            return EncodedValue.absent(null);
        }
        SAtom atom = child.atom(0);
        return EncodedValue.read(atom.text(), child)
                .withAtomStyle(AtomStyle.of(atom))
                .withTokenName(child.tag());
    }

    public static SNode textNode(String tag, EncodedValue<String> field, AtomStyle canonical) {
        if (field == null || !field.isExplicit() || field.getValue() == null) {
            return null;
        }
        if (field.isParsed()) {
            return field.getSource();
        }
        return SExpressionBuilder.create(field.tokenNameOr(tag))
                .addAtom(field.atomStyleOr(canonical).toAtom(field.getValue()))
                .build();
    }

    // --- numbers ------------------------------------------------------------

    public static EncodedValue<Integer> readInt(SList parent, String tag, Integer defaultValue) {
        SList child = parent.child(tag);
        if (child == null || child.getInt(0) == null) {
            return EncodedValue.absent(defaultValue);
        }
        return EncodedValue.read(child.getInt(0), child);
    }

    public static SNode intNode(String tag, EncodedValue<Integer> field) {
        if (field == null || !field.isExplicit() || field.getValue() == null) {
            return null;
        }
        if (field.isParsed()) {
            return field.getSource();
        }
        return SExpressionBuilder.create(tag).addValue(field.getValue().longValue()).build();
    }

    public static EncodedValue<Coord> readCoord(SList parent, String tag, Coord defaultValue) {
        SList child = parent.child(tag);
        if (child == null || child.getCoord(0) == null) {
            return EncodedValue.absent(defaultValue);
        }
        return EncodedValue.read(child.getCoord(0), child);
    }

    public static SNode coordNode(String tag, EncodedValue<Coord> field) {
        if (field == null || !field.isExplicit() || field.getValue() == null) {
            return null;
        }
        if (field.isParsed()) {
            return field.getSource();
        }
        return SExpressionBuilder.create(tag).addMm(field.getValue()).build();
    }

    // --- booleans -----------------------------------------------------------

    /** Reads {@code (tag yes|no)}. */
    public static EncodedValue<Boolean> readBool(SList parent, String tag, boolean defaultValue) {
        SList child = parent.child(tag);
        if (child == null) {
            return EncodedValue.absent(defaultValue);
        }
        Boolean value = child.getBool(0);
        return EncodedValue.read(value != null ? value : defaultValue, child);
    }

    public static SNode boolNode(String tag, EncodedValue<Boolean> field) {
        if (field == null || !field.isExplicit()) {
            return null;
        }
        if (field.isParsed()) {
            return field.getSource();
        }
        return SExpressionBuilder.create(tag).addBool(Boolean.TRUE.equals(field.getValue())).build();
    }

    /**
     * Reads a flag written either as the bare symbol {@code name} among the
     * parent's values or as a child node {@code (name)} / {@code (name yes|no)}.
     */
    public static EncodedValue<Boolean> readFlag(SList parent, String name) {
        for (int i = 1; i < parent.size(); i++) {
            SNode child = parent.get(i);
            if (child instanceof SSymbol symbol && symbol.value().equals(name)) {
                return EncodedValue.read(Boolean.TRUE, child).withFlagStyle(FlagStyle.BARE_SYMBOL);
            }
        }
        SList node = parent.child(name);
        if (node == null) {
            return EncodedValue.absent(Boolean.FALSE);
        }
        Boolean value = node.getBool(0);
        return EncodedValue.read(value == null || value, node).withFlagStyle(FlagStyle.CHILD_NODE);
    }

    /**
     * Node for a flag, or null when nothing is written. A false flag only
     * survives as the {@code (name no)} it was read from.
     */
    public static SNode flagNode(String name, EncodedValue<Boolean> field, FlagStyle canonical) {
        if (field == null) {
            return null;
        }
        if (field.isParsed()) {
            return field.getSource();
        }
        if (!Boolean.TRUE.equals(field.getValue())) {
            return null;
        }
        if (field.flagStyleOr(canonical) == FlagStyle.BARE_SYMBOL) {
            return new SSymbol(name);
        }
        return SExpressionBuilder.create(name).addBool(true).build();
    }

    // --- identity -----------------------------------------------------------

    /** Reads {@code (uuid "...")} or the legacy {@code (tstamp ...)}. */
    public static EncodedValue<String> readUuid(SList parent) {
        return readText(parent, UUID, TSTAMP);
    }

    public static SNode uuidNode(EncodedValue<String> field) {
        return textNode(UUID, field, AtomStyle.STRING);
    }

    /** True for the child carrying an element's identity in either spelling. */
    public static boolean isUuid(SNode node) {
        return node instanceof SList list && (list.hasTag(UUID) || list.hasTag(TSTAMP));
    }

    // --- helpers ------------------------------------------------------------

    public static SList findChild(SList parent, String tag, String... legacyTags) {
        SList child = parent.child(tag);
        for (int i = 0; child == null && i < legacyTags.length; i++) {
            child = parent.child(legacyTags[i]);
        }
        return child;
    }
}
