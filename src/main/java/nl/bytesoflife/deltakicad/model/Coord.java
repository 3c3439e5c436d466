package nl.bytesoflife.deltakicad.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point physical length. The internal unit is one nanometre, so every
 * millimetre value with up to six fractional digits converts without loss.
 * Equality and ordering compare the integer representation only.
 */
public final class Coord implements Comparable<Coord> {

    public static final int MM_SCALE = 6;
    public static final long NM_PER_MM = 1_000_000L;

    public static final Coord ZERO = new Coord(0);

    private final long nm;

    private Coord(long nm) {
        this.nm = nm;
    }

    public static Coord fromNm(long nm) {
        return nm == 0 ? ZERO : new Coord(nm);
    }

    public static Coord fromMm(double mm) {
        if (Double.isNaN(mm) || Double.isInfinite(mm)) {
            throw new IllegalArgumentException("Not a finite length: " + mm);
        }
        return fromMm(BigDecimal.valueOf(mm));
    }

    public static Coord fromMm(BigDecimal mm) {
        BigDecimal scaled = mm.setScale(MM_SCALE, RoundingMode.HALF_UP);
        return fromNm(scaled.unscaledValue().longValueExact());
    }

    public static Coord fromMm(String mm) {
        return fromMm(new BigDecimal(mm.trim()));
    }

    public long toNm() {
        return nm;
    }

    public double toMm() {
        return nm / (double) NM_PER_MM;
    }

    /** Exact millimetre value, trailing zeros stripped. */
    public BigDecimal toMmDecimal() {
        if (nm == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(nm, MM_SCALE).stripTrailingZeros();
    }

    public Coord plus(Coord other) {
        return fromNm(Math.addExact(nm, other.nm));
    }

    public Coord minus(Coord other) {
        return fromNm(Math.subtractExact(nm, other.nm));
    }

    public Coord times(long factor) {
        return fromNm(Math.multiplyExact(nm, factor));
    }

    public Coord times(double factor) {
        return fromNm(roundExact(nm * factor));
    }

    public Coord dividedBy(long divisor) {
        if (divisor == 0) {
            throw new ArithmeticException("Division of a length by zero");
        }
        BigDecimal quotient = BigDecimal.valueOf(nm).divide(BigDecimal.valueOf(divisor), 0, RoundingMode.HALF_UP);
        return fromNm(quotient.longValueExact());
    }

    public Coord dividedBy(double divisor) {
        if (divisor == 0.0) {
            throw new ArithmeticException("Division of a length by zero");
        }
        return fromNm(roundExact(nm / divisor));
    }

    public Coord negate() {
        return fromNm(Math.negateExact(nm));
    }

    public Coord abs() {
        return nm < 0 ? negate() : this;
    }

    public boolean isZero() {
        return nm == 0;
    }

    public static Coord min(Coord a, Coord b) {
        return a.nm <= b.nm ? a : b;
    }

    public static Coord max(Coord a, Coord b) {
        return a.nm >= b.nm ? a : b;
    }

    private static long roundExact(double value) {
        if (Double.isNaN(value) || value >= Long.MAX_VALUE || value <= Long.MIN_VALUE) {
            throw new ArithmeticException("Length out of range: " + value);
        }
        return Math.round(value);
    }

    @Override
    public int compareTo(Coord other) {
        return Long.compare(nm, other.nm);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Coord other && other.nm == nm;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nm);
    }

    @Override
    public String toString() {
        return toMmDecimal().toPlainString() + "mm";
    }
}
