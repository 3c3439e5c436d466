package nl.bytesoflife.deltakicad.fidelity;

/**
 * How a boolean flag was written: KiCad 7 and earlier use a bare keyword
 * ({@code (effects ... hide)}), KiCad 8 a child node ({@code (hide yes)}).
 */
public enum FlagStyle {
    BARE_SYMBOL,
    CHILD_NODE
}
