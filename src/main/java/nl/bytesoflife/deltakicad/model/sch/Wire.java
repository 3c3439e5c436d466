package nl.bytesoflife.deltakicad.model.sch;

import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.KiCadElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Schematic wire: {@code (wire (pts (xy ..) (xy ..)) (stroke ..) (uuid ..))}. */
public class Wire extends KiCadElement {

    private final List<CoordPoint> points = new ArrayList<>();
    private EncodedValue<String> uuid = EncodedValue.absent(null);

    public Wire() {
    }

    public Wire(CoordPoint start, CoordPoint end) {
        points.add(start);
        points.add(end);
    }

    public List<CoordPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public void setPoints(List<CoordPoint> points) {
        this.points.clear();
        this.points.addAll(points);
    }

    public String getUuid() {
        return uuid.getValue();
    }

    public void setUuid(String uuid) {
        this.uuid = this.uuid.withValue(uuid);
    }

    public EncodedValue<String> getUuidField() {
        return uuid;
    }

    public void setUuidField(EncodedValue<String> uuid) {
        this.uuid = uuid;
    }

    @Override
    public String toString() {
        return "Wire" + points;
    }
}
