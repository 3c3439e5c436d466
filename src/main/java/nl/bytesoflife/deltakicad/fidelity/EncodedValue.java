package nl.bytesoflife.deltakicad.fidelity;

import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.Objects;

/**
 * A field value together with the way it was encoded in the file it came
 * from: whether it was present or defaulted, symbol or string spelling, bare
 * flag or child node, and which token name (current or legacy) carried it.
 * <p>
 * Values read from a file keep their encoding so that writing reproduces it.
 * Values created in memory leave the encoding unset and writers fall back to
 * the newest KiCad convention. Changing the value keeps the encoding but
 * forgets the source node.
 */
public final class EncodedValue<T> {

    private final T value;
    private final boolean explicit;
    private final AtomStyle atomStyle;
    private final FlagStyle flagStyle;
    private final String tokenName;
    private final SNode source;

    private EncodedValue(T value, boolean explicit, AtomStyle atomStyle, FlagStyle flagStyle,
                         String tokenName, SNode source) {
        this.value = value;
        this.explicit = explicit;
        this.atomStyle = atomStyle;
        this.flagStyle = flagStyle;
        this.tokenName = tokenName;
        this.source = source;
    }

    /** Value set in memory; written with the canonical encoding. */
    public static <T> EncodedValue<T> fresh(T value) {
        return new EncodedValue<>(value, true, null, null, null, null);
    }

    /** Field absent from the source; {@code defaultValue} is implied and not written. */
    public static <T> EncodedValue<T> absent(T defaultValue) {
        return new EncodedValue<>(defaultValue, false, null, null, null, null);
    }

    /** Field present in the source as {@code source}. */
    public static <T> EncodedValue<T> read(T value, SNode source) {
        return new EncodedValue<>(value, true, null, null, null, source);
    }

    public EncodedValue<T> withAtomStyle(AtomStyle style) {
        return new EncodedValue<>(value, explicit, style, flagStyle, tokenName, source);
    }

    public EncodedValue<T> withFlagStyle(FlagStyle style) {
        return new EncodedValue<>(value, explicit, atomStyle, style, tokenName, source);
    }

    public EncodedValue<T> withTokenName(String name) {
        return new EncodedValue<>(value, explicit, atomStyle, flagStyle, name, source);
    }

    /**
     * Returns a value carrying {@code newValue} with this encoding. Setting
     * the current value again returns this instance unchanged.
     */
    public EncodedValue<T> withValue(T newValue) {
        if (Objects.equals(newValue, value)) {
            return this;
        }
        return new EncodedValue<>(newValue, true, atomStyle, flagStyle, tokenName, null);
    }

    public T getValue() {
        return value;
    }

    public boolean isExplicit() {
        return explicit;
    }

    public boolean isParsed() {
        return source != null;
    }

    public SNode getSource() {
        return source;
    }

    public AtomStyle getAtomStyle() {
        return atomStyle;
    }

    public FlagStyle getFlagStyle() {
        return flagStyle;
    }

    public String getTokenName() {
        return tokenName;
    }

    public AtomStyle atomStyleOr(AtomStyle canonical) {
        return atomStyle != null ? atomStyle : canonical;
    }

    public FlagStyle flagStyleOr(FlagStyle canonical) {
        return flagStyle != null ? flagStyle : canonical;
    }

    public String tokenNameOr(String canonical) {
        return tokenName != null ? tokenName : canonical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncodedValue<?> other)) return false;
        return explicit == other.explicit
                && Objects.equals(value, other.value)
                && atomStyle == other.atomStyle
                && flagStyle == other.flagStyle
                && Objects.equals(tokenName, other.tokenName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, explicit, atomStyle, flagStyle, tokenName);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EncodedValue{").append(value);
        if (!explicit) sb.append(", default");
        if (atomStyle != null) sb.append(", ").append(atomStyle);
        if (flagStyle != null) sb.append(", ").append(flagStyle);
        if (tokenName != null) sb.append(", token=").append(tokenName);
        return sb.append('}').toString();
    }
}
