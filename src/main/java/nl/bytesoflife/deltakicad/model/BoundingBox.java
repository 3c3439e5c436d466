package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;

/**
 * Axis-aligned bounding box in board coordinates. Backed by a JTS
 * {@link Envelope} holding nanometre values, so every corner converts back to
 * an exact {@link Coord}.
 */
public final class BoundingBox {

    private final Envelope envelope;

    private BoundingBox(Envelope envelope) {
        this.envelope = envelope;
    }

    public static BoundingBox empty() {
        return new BoundingBox(new Envelope());
    }

    public static BoundingBox of(CoordPoint a, CoordPoint b) {
        return new BoundingBox(new Envelope(toCoordinate(a), toCoordinate(b)));
    }

    /** Box of a {@code size} rectangle centred on {@code center}, rotated by {@code angleDegrees}. */
    public static BoundingBox ofRotatedRect(CoordPoint center, CoordPoint size, double angleDegrees) {
        double halfW = size.x().toNm() / 2.0;
        double halfH = size.y().toNm() / 2.0;
        AffineTransformation transform = rotation(angleDegrees)
                .translate(center.x().toNm(), center.y().toNm());
        Envelope env = new Envelope();
        for (Coordinate corner : new Coordinate[]{
                new Coordinate(-halfW, -halfH), new Coordinate(halfW, -halfH),
                new Coordinate(halfW, halfH), new Coordinate(-halfW, halfH)}) {
            env.expandToInclude(transform.transform(corner, new Coordinate()));
        }
        return new BoundingBox(env);
    }

    /**
     * KiCad angles are in degrees, counter-clockwise as seen on screen with
     * the y axis pointing down.
     */
    static AffineTransformation rotation(double angleDegrees) {
        return AffineTransformation.rotationInstance(-Math.toRadians(angleDegrees));
    }

    public BoundingBox expandToInclude(CoordPoint point) {
        Envelope copy = envelope.copy();
        copy.expandToInclude(toCoordinate(point));
        return new BoundingBox(copy);
    }

    public BoundingBox expandToInclude(BoundingBox other) {
        Envelope copy = envelope.copy();
        copy.expandToInclude(other.envelope);
        return new BoundingBox(copy);
    }

    public BoundingBox expandBy(Coord distance) {
        if (isEmpty()) {
            return this;
        }
        Envelope copy = envelope.copy();
        copy.expandBy(distance.toNm());
        return new BoundingBox(copy);
    }

    /** This box after rotating by {@code angleDegrees} around the origin and moving to {@code offset}. */
    public BoundingBox transform(CoordPoint offset, double angleDegrees) {
        if (isEmpty()) {
            return this;
        }
        AffineTransformation transform = rotation(angleDegrees)
                .translate(offset.x().toNm(), offset.y().toNm());
        Envelope env = new Envelope();
        for (Coordinate corner : new Coordinate[]{
                new Coordinate(envelope.getMinX(), envelope.getMinY()),
                new Coordinate(envelope.getMaxX(), envelope.getMinY()),
                new Coordinate(envelope.getMaxX(), envelope.getMaxY()),
                new Coordinate(envelope.getMinX(), envelope.getMaxY())}) {
            env.expandToInclude(transform.transform(corner, new Coordinate()));
        }
        return new BoundingBox(env);
    }

    public boolean isEmpty() {
        return envelope.isNull();
    }

    public boolean contains(CoordPoint point) {
        return envelope.contains(toCoordinate(point));
    }

    public boolean intersects(BoundingBox other) {
        return envelope.intersects(other.envelope);
    }

    public Coord getMinX() {
        return nm(envelope.getMinX());
    }

    public Coord getMinY() {
        return nm(envelope.getMinY());
    }

    public Coord getMaxX() {
        return nm(envelope.getMaxX());
    }

    public Coord getMaxY() {
        return nm(envelope.getMaxY());
    }

    public Coord getWidth() {
        return isEmpty() ? Coord.ZERO : getMaxX().minus(getMinX());
    }

    public Coord getHeight() {
        return isEmpty() ? Coord.ZERO : getMaxY().minus(getMinY());
    }

    public CoordPoint getCenter() {
        if (isEmpty()) {
            return CoordPoint.ZERO;
        }
        return new CoordPoint(getMinX().plus(getMaxX()).dividedBy(2), getMinY().plus(getMaxY()).dividedBy(2));
    }

    private static Coord nm(double value) {
        return Coord.fromNm(Math.round(value));
    }

    private static Coordinate toCoordinate(CoordPoint point) {
        return new Coordinate(point.x().toNm(), point.y().toNm());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoundingBox other && other.envelope.equals(envelope);
    }

    @Override
    public int hashCode() {
        return envelope.hashCode();
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "BoundingBox{empty}";
        }
        return "BoundingBox{" + getMinX() + ", " + getMinY() + " - " + getMaxX() + ", " + getMaxY() + "}";
    }
}
