package nl.bytesoflife.deltakicad.model;

public record CoordPoint(Coord x, Coord y) {

    public static final CoordPoint ZERO = new CoordPoint(Coord.ZERO, Coord.ZERO);

    public static CoordPoint ofMm(double x, double y) {
        return new CoordPoint(Coord.fromMm(x), Coord.fromMm(y));
    }

    public CoordPoint plus(CoordPoint other) {
        return new CoordPoint(x.plus(other.x), y.plus(other.y));
    }

    /** Rotates around the origin, counter-clockwise on screen (y axis down). */
    public CoordPoint rotated(double angleDegrees) {
        if (angleDegrees == 0.0) {
            return this;
        }
        double rad = Math.toRadians(angleDegrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        double px = x.toNm();
        double py = y.toNm();
        return new CoordPoint(
                Coord.fromNm(Math.round(px * cos + py * sin)),
                Coord.fromNm(Math.round(-px * sin + py * cos)));
    }

    @Override
    public String toString() {
        return "(" + x.toMmDecimal().toPlainString() + ", " + y.toMmDecimal().toPlainString() + ")";
    }
}
