package nl.bytesoflife.deltakicad.model.common;

import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;

import java.util.Objects;

/**
 * Location written as {@code (at x y [angle])}. A null angle means the file
 * left it out, which is not the same as an explicit {@code 0}.
 */
public record Position(Coord x, Coord y, Double angle) {

    public static final Position ORIGIN = new Position(Coord.ZERO, Coord.ZERO, null);

    public Position {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }

    public static Position of(Coord x, Coord y) {
        return new Position(x, y, null);
    }

    public static Position ofMm(double x, double y, double angle) {
        return new Position(Coord.fromMm(x), Coord.fromMm(y), angle);
    }

    public double angleOrZero() {
        return angle != null ? angle : 0.0;
    }

    public boolean hasAngle() {
        return angle != null;
    }

    public CoordPoint toPoint() {
        return new CoordPoint(x, y);
    }

    public Position withAngle(Double newAngle) {
        return new Position(x, y, newAngle);
    }

    public Position movedBy(Coord dx, Coord dy) {
        return new Position(x.plus(dx), y.plus(dy), angle);
    }
}
