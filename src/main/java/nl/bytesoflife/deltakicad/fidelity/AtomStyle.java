package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.parser.SExpressionParser;

/**
 * How a textual value was spelled: bare symbol or quoted string. KiCad 6
 * quotes most identifiers that older releases wrote bare.
 */
public enum AtomStyle {
    SYMBOL,
    STRING,
    NUMBER;

    public static AtomStyle of(SAtom atom) {
        if (atom instanceof SString) return STRING;
        if (atom instanceof SNumber) return NUMBER;
        return SYMBOL;
    }

    /**
     * Creates an atom carrying {@code text} in this style. Text that cannot be
     * a bare symbol falls back to a quoted string; bare numeric text becomes a
     * number, as it would when parsed.
     */
    public SAtom toAtom(String text) {
        if (this == STRING || !isBareSafe(text)) {
            return new SString(text);
        }
        return SExpressionParser.bareAtom(text);
    }

    static boolean isBareSafe(String text) {
        if (text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == ')' || c == '"' || c == '\\' || Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }
}
