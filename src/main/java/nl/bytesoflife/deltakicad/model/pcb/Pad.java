package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.fidelity.AtomStyle;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.BoundingBox;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.KiCadElement;
import nl.bytesoflife.deltakicad.model.common.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Footprint pad: {@code (pad "1" smd roundrect (at x y) (size w h) (layers ...))}.
 * Positions are relative to the owning footprint.
 */
public class Pad extends KiCadElement {

    private EncodedValue<String> number;
    private String type;
    private String shape;
    private Position position;
    private CoordPoint size;
    private EncodedValue<Coord> drill = EncodedValue.absent(null);
    private final List<String> layers = new ArrayList<>();
    private AtomStyle layerStyle;
    private Net net;
    private EncodedValue<String> uuid = EncodedValue.absent(null);

    public Pad(String number, String type, String shape) {
        this.number = EncodedValue.fresh(number);
        this.type = type;
        this.shape = shape;
    }

    public String getNumber() {
        return number.getValue();
    }

    public void setNumber(String number) {
        this.number = this.number.withValue(number);
    }

    public EncodedValue<String> getNumberField() {
        return number;
    }

    public void setNumberField(EncodedValue<String> number) {
        this.number = number;
    }

    /** {@code smd}, {@code thru_hole}, {@code np_thru_hole} or {@code connect}. */
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getShape() {
        return shape;
    }

    public void setShape(String shape) {
        this.shape = shape;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    public CoordPoint getSize() {
        return size;
    }

    public void setSize(CoordPoint size) {
        this.size = size;
    }

    /** Drill diameter, or null for pads without a hole. */
    public Coord getDrill() {
        return drill.getValue();
    }

    public void setDrill(Coord drill) {
        this.drill = this.drill.withValue(drill);
    }

    public EncodedValue<Coord> getDrillField() {
        return drill;
    }

    public void setDrillField(EncodedValue<Coord> drill) {
        this.drill = drill;
    }

    public List<String> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public void setLayers(List<String> layers) {
        this.layers.clear();
        this.layers.addAll(layers);
    }

    /** Spelling of the layer names, or null for the canonical quoted form. */
    public AtomStyle getLayerStyle() {
        return layerStyle;
    }

    public void setLayerStyle(AtomStyle layerStyle) {
        this.layerStyle = layerStyle;
    }

    public Net getNet() {
        return net;
    }

    public void setNet(Net net) {
        this.net = net;
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

    public boolean isThroughHole() {
        return "thru_hole".equals(type) || "np_thru_hole".equals(type);
    }

    /** Extent of the pad copper in footprint coordinates; empty without position or size. */
    public BoundingBox getBoundingBox() {
        if (position == null || size == null) {
            return BoundingBox.empty();
        }
        return BoundingBox.ofRotatedRect(position.toPoint(), size, position.angleOrZero());
    }

    @Override
    public String toString() {
        return "Pad{" + number.getValue() + " " + type + " " + shape + "}";
    }
}
