package nl.bytesoflife.deltakicad.sexpr;

import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fluent construction of an {@link SList}. Invalid arguments are caller bugs
 * and are rejected immediately with an exception.
 */
public final class SExpressionBuilder {

    private final List<SNode> children = new ArrayList<>();
    private ListLayout layout;

    private SExpressionBuilder(String tag) {
        children.add(new SSymbol(requireSymbol(tag)));
    }

    public static SExpressionBuilder create(String tag) {
        return new SExpressionBuilder(tag);
    }

    /** Appends a quoted string. */
    public SExpressionBuilder addValue(String value) {
        Objects.requireNonNull(value, "value");
        children.add(new SString(value));
        return this;
    }

    public SExpressionBuilder addValue(long value) {
        children.add(SNumber.of(value));
        return this;
    }

    public SExpressionBuilder addValue(double value) {
        children.add(SNumber.of(value));
        return this;
    }

    public SExpressionBuilder addValue(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        children.add(SNumber.of(value));
        return this;
    }

    /** Appends a bare symbol such as a keyword or layer name. */
    public SExpressionBuilder addSymbol(String name) {
        children.add(new SSymbol(requireSymbol(name)));
        return this;
    }

    public SExpressionBuilder addMm(Coord coord) {
        Objects.requireNonNull(coord, "coord");
        children.add(SNumber.of(coord.toMmDecimal()));
        return this;
    }

    public SExpressionBuilder addBool(boolean value) {
        children.add(new SSymbol(value ? "yes" : "no"));
        return this;
    }

    /** Appends an existing atom unchanged, keeping its original spelling. */
    public SExpressionBuilder addAtom(SAtom atom) {
        Objects.requireNonNull(atom, "atom");
        children.add(atom);
        return this;
    }

    public SExpressionBuilder addChild(String tag, Consumer<SExpressionBuilder> configure) {
        Objects.requireNonNull(configure, "configure");
        SExpressionBuilder child = new SExpressionBuilder(tag);
        configure.accept(child);
        children.add(child.build());
        return this;
    }

    /** Appends an already built or raw-passthrough node. */
    public SExpressionBuilder addChild(SNode node) {
        Objects.requireNonNull(node, "node");
        children.add(node);
        return this;
    }

    public SExpressionBuilder addChildren(List<? extends SNode> nodes) {
        for (SNode node : nodes) {
            addChild(node);
        }
        return this;
    }

    /**
     * Re-uses the line-break shape of {@code source} when the built list ends
     * up with the same number of children.
     */
    public SExpressionBuilder layoutFrom(SList source) {
        this.layout = source != null ? source.layout() : null;
        return this;
    }

    public SExpressionBuilder layout(ListLayout layout) {
        this.layout = layout;
        return this;
    }

    public int size() {
        return children.size();
    }

    public SList build() {
        return new SList(children, layout);
    }

    static String requireSymbol(String name) {
        Objects.requireNonNull(name, "symbol");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol must not be empty");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '(' || c == ')' || c == '"' || c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                throw new IllegalArgumentException("Not a valid bare symbol: '" + name + "'");
            }
        }
        return name;
    }
}
