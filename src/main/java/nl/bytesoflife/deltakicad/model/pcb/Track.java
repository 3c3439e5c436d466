package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.BoundingBox;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.KiCadElement;

/** Straight copper segment: {@code (segment (start ..) (end ..) (width ..) (layer ..) (net ..))}. */
public class Track extends KiCadElement {

    private CoordPoint start;
    private CoordPoint end;
    private Coord width;
    private EncodedValue<String> layer = EncodedValue.absent(null);
    private Integer net;
    private EncodedValue<Boolean> locked = EncodedValue.absent(Boolean.FALSE);
    private EncodedValue<String> uuid = EncodedValue.absent(null);

    public Track() {
    }

    public Track(CoordPoint start, CoordPoint end, Coord width, String layer) {
        this.start = start;
        this.end = end;
        this.width = width;
        this.layer = EncodedValue.fresh(layer);
    }

    public CoordPoint getStart() {
        return start;
    }

    public void setStart(CoordPoint start) {
        this.start = start;
    }

    public CoordPoint getEnd() {
        return end;
    }

    public void setEnd(CoordPoint end) {
        this.end = end;
    }

    public Coord getWidth() {
        return width;
    }

    public void setWidth(Coord width) {
        this.width = width;
    }

    public String getLayer() {
        return layer.getValue();
    }

    public void setLayer(String layer) {
        this.layer = this.layer.withValue(layer);
    }

    public EncodedValue<String> getLayerField() {
        return layer;
    }

    public void setLayerField(EncodedValue<String> layer) {
        this.layer = layer;
    }

    /** Net number, or null when the segment does not name one. */
    public Integer getNet() {
        return net;
    }

    public void setNet(Integer net) {
        this.net = net;
    }

    public boolean isLocked() {
        return locked.getValue();
    }

    public void setLocked(boolean locked) {
        this.locked = this.locked.withValue(locked);
    }

    public EncodedValue<Boolean> getLockedField() {
        return locked;
    }

    public void setLockedField(EncodedValue<Boolean> locked) {
        this.locked = locked;
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

    public BoundingBox getBoundingBox() {
        if (start == null || end == null) {
            return BoundingBox.empty();
        }
        BoundingBox box = BoundingBox.of(start, end);
        return width != null ? box.expandBy(width.dividedBy(2)) : box;
    }

    @Override
    public String toString() {
        return "Track{" + start + " -> " + end + ", width=" + width + ", layer=" + layer.getValue() + "}";
    }
}
