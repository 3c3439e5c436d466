package nl.bytesoflife.deltakicad.sexpr;

import java.util.Objects;

/**
 * Output formatting settings. KiCad 8 and later indent with one tab per
 * nesting level; KiCad 6 and 7 used two spaces.
 */
public record SExpressionFormat(String indentUnit) {

    public static final SExpressionFormat KICAD_CURRENT = new SExpressionFormat("\t");
    public static final SExpressionFormat KICAD_LEGACY = new SExpressionFormat("  ");

    public SExpressionFormat {
        Objects.requireNonNull(indentUnit, "indentUnit");
        if (!indentUnit.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("Indent unit must consist of spaces or tabs");
        }
    }

    public static SExpressionFormat spaces(int count) {
        if (count == 2) return KICAD_LEGACY;
        return new SExpressionFormat(" ".repeat(count));
    }
}
