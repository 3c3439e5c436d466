package nl.bytesoflife.deltakicad.sexpr;

import nl.bytesoflife.deltakicad.model.Coord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node of an S-expression tree. A node is either an atom (symbol, string or
 * number) or a list. Nodes are immutable once built.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    sealed interface SAtom extends SNode permits SSymbol, SString, SNumber {

        /** The atom as text: symbol name, decoded string, or the number's spelling. */
        String text();
    }

    record SSymbol(String value) implements SAtom {
        public SSymbol {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Quoted string. {@code originalText} is the exact spelling between the
     * quotes as read from a file, or null for strings built in memory.
     * Equality only considers the decoded value.
     */
    record SString(String value, String originalText) implements SAtom {
        public SString {
            Objects.requireNonNull(value, "value");
        }

        public SString(String value) {
            this(value, null);
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SString other && other.value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * Integer or real number. {@code originalText} is the spelling read from a
     * file, or null for numbers built in memory. Equality is numeric.
     */
    record SNumber(BigDecimal value, String originalText) implements SAtom {
        public SNumber {
            Objects.requireNonNull(value, "value");
        }

        /** Number built in memory, rounded to six fractional digits. */
        public static SNumber of(BigDecimal value) {
            BigDecimal rounded = value.setScale(Coord.MM_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
            if (rounded.signum() == 0) {
                rounded = BigDecimal.ZERO;
            }
            return new SNumber(rounded, null);
        }

        public static SNumber of(double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Not a finite number: " + value);
            }
            return of(BigDecimal.valueOf(value));
        }

        public static SNumber of(long value) {
            return new SNumber(BigDecimal.valueOf(value), null);
        }

        /** Canonical spelling: plain notation, no trailing zeros. */
        public String canonicalText() {
            if (value.signum() == 0) {
                return "0";
            }
            return value.stripTrailingZeros().toPlainString();
        }

        @Override
        public String text() {
            return originalText != null ? originalText : canonicalText();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SNumber other && other.value.compareTo(value) == 0;
        }

        @Override
        public int hashCode() {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }

        @Override
        public String toString() {
            return text();
        }
    }

    /**
     * Ordered list of children. By convention child 0 is a symbol naming the
     * node. {@code layout} is the line-break shape captured by the parser and
     * is null for lists built in memory; equality ignores it.
     */
    record SList(List<SNode> children, ListLayout layout) implements SNode {

        public SList {
            children = List.copyOf(children);
            if (layout != null && layout.size() != children.size()) {
                layout = null;
            }
        }

        public SList(List<SNode> children) {
            this(children, null);
        }

        public static SList of(SNode... children) {
            return new SList(List.of(children));
        }

        /** Tag naming this list, or "" when the first child is not a symbol. */
        public String tag() {
            if (children.isEmpty()) return "";
            return children.get(0) instanceof SSymbol symbol ? symbol.value() : "";
        }

        public boolean hasTag(String tag) {
            return tag().equals(tag);
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        /** Atoms following the tag, in order. */
        public List<SAtom> atoms() {
            List<SAtom> atoms = new ArrayList<>();
            for (int i = 1; i < children.size(); i++) {
                if (children.get(i) instanceof SAtom atom) {
                    atoms.add(atom);
                }
            }
            return atoms;
        }

        /** Nested lists, in order. */
        public List<SList> lists() {
            List<SList> lists = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list) {
                    lists.add(list);
                }
            }
            return lists;
        }

        public SList child(String tag) {
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    return list;
                }
            }
            return null;
        }

        public List<SList> children(String tag) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    result.add(list);
                }
            }
            return result;
        }

        public boolean hasSymbol(String name) {
            for (int i = 1; i < children.size(); i++) {
                if (children.get(i) instanceof SSymbol symbol && symbol.value().equals(name)) {
                    return true;
                }
            }
            return false;
        }

        public SAtom atom(int index) {
            List<SAtom> atoms = atoms();
            return index >= 0 && index < atoms.size() ? atoms.get(index) : null;
        }

        /** Text of the atom at {@code index}, or null when absent. */
        public String getString(int index) {
            SAtom atom = atom(index);
            return atom != null ? atom.text() : null;
        }

        public BigDecimal getNumber(int index) {
            return atom(index) instanceof SNumber number ? number.value() : null;
        }

        public Double getDouble(int index) {
            BigDecimal number = getNumber(index);
            return number != null ? number.doubleValue() : null;
        }

        public Integer getInt(int index) {
            BigDecimal number = getNumber(index);
            if (number == null) return null;
            try {
                return number.intValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }

        /** Length at {@code index}, or null when it is not a number or does not fit a {@link Coord}. */
        public Coord getCoord(int index) {
            BigDecimal number = getNumber(index);
            if (number == null) return null;
            try {
                return Coord.fromMm(number);
            } catch (ArithmeticException e) {
                return null;
            }
        }

        /** {@code yes}/{@code no} symbol at {@code index}, or null. */
        public Boolean getBool(int index) {
            if (!(atom(index) instanceof SSymbol symbol)) return null;
            return switch (symbol.value()) {
                case "yes" -> Boolean.TRUE;
                case "no" -> Boolean.FALSE;
                default -> null;
            };
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SList other && other.children.equals(children);
        }

        @Override
        public int hashCode() {
            return children.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
