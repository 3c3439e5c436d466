package nl.bytesoflife.deltakicad.model.sch;

import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.KiCadElement;
import nl.bytesoflife.deltakicad.model.common.Position;
import nl.bytesoflife.deltakicad.model.common.Property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Symbol placed on a schematic sheet, referring to a library symbol by {@code lib_id}. */
public class SchematicSymbol extends KiCadElement {

    private EncodedValue<String> libId;
    private Position position;
    private EncodedValue<Integer> unit = EncodedValue.fresh(1);
    private EncodedValue<Boolean> inBom = EncodedValue.fresh(Boolean.TRUE);
    private EncodedValue<Boolean> onBoard = EncodedValue.fresh(Boolean.TRUE);
    private EncodedValue<String> uuid = EncodedValue.absent(null);
    private final List<Property> properties = new ArrayList<>();

    public SchematicSymbol(String libId) {
        this.libId = EncodedValue.fresh(libId);
    }

    public String getLibId() {
        return libId.getValue();
    }

    public void setLibId(String libId) {
        this.libId = this.libId.withValue(libId);
    }

    public EncodedValue<String> getLibIdField() {
        return libId;
    }

    public void setLibIdField(EncodedValue<String> libId) {
        this.libId = libId;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    public int getUnit() {
        return unit.getValue();
    }

    public void setUnit(int unit) {
        this.unit = this.unit.withValue(unit);
    }

    public EncodedValue<Integer> getUnitField() {
        return unit;
    }

    public void setUnitField(EncodedValue<Integer> unit) {
        this.unit = unit;
    }

    public boolean isInBom() {
        return inBom.getValue();
    }

    public void setInBom(boolean inBom) {
        this.inBom = this.inBom.withValue(inBom);
    }

    public EncodedValue<Boolean> getInBomField() {
        return inBom;
    }

    public void setInBomField(EncodedValue<Boolean> inBom) {
        this.inBom = inBom;
    }

    public boolean isOnBoard() {
        return onBoard.getValue();
    }

    public void setOnBoard(boolean onBoard) {
        this.onBoard = this.onBoard.withValue(onBoard);
    }

    public EncodedValue<Boolean> getOnBoardField() {
        return onBoard;
    }

    public void setOnBoardField(EncodedValue<Boolean> onBoard) {
        this.onBoard = onBoard;
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

    public List<Property> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    /** Adds {@code property}; unless told otherwise, hiding it later writes {@code (hide yes)} in its effects. */
    public void addProperty(Property property) {
        if (property.getEffectsHideStyle() == null) {
            property.setEffectsHideStyle(FlagStyle.CHILD_NODE);
        }
        properties.add(property);
    }

    public Property getProperty(String key) {
        for (Property property : properties) {
            if (property.getKey().equals(key)) {
                return property;
            }
        }
        return null;
    }

    public String getReference() {
        Property property = getProperty("Reference");
        return property != null ? property.getValue() : null;
    }

    @Override
    public String toString() {
        return "SchematicSymbol{" + libId.getValue() + ", ref=" + getReference() + "}";
    }
}
