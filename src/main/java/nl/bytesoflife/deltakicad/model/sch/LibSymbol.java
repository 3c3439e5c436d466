package nl.bytesoflife.deltakicad.model.sch;

import nl.bytesoflife.deltakicad.fidelity.ChildOrder;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.KiCadElement;
import nl.bytesoflife.deltakicad.model.common.Property;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Symbol definition from a symbol library or a schematic's
 * {@code lib_symbols}. Unit sub-symbols holding the graphics and pins are
 * kept as raw subtrees.
 */
public class LibSymbol extends KiCadElement {

    private EncodedValue<String> name;
    private EncodedValue<String> extendsName = EncodedValue.absent(null);
    private EncodedValue<Boolean> pinNumbersHide = EncodedValue.absent(Boolean.FALSE);
    private ChildOrder pinNumbersOrder = ChildOrder.empty();
    private EncodedValue<Coord> pinNamesOffset = EncodedValue.absent(null);
    private EncodedValue<Boolean> pinNamesHide = EncodedValue.absent(Boolean.FALSE);
    private ChildOrder pinNamesOrder = ChildOrder.empty();
    private EncodedValue<Boolean> excludeFromSim = EncodedValue.absent(Boolean.FALSE);
    private EncodedValue<Boolean> inBom = EncodedValue.fresh(Boolean.TRUE);
    private EncodedValue<Boolean> onBoard = EncodedValue.fresh(Boolean.TRUE);
    private final List<Property> properties = new ArrayList<>();

    public LibSymbol(String name) {
        this.name = EncodedValue.fresh(name);
    }

    public String getName() {
        return name.getValue();
    }

    public void setName(String name) {
        this.name = this.name.withValue(name);
    }

    public EncodedValue<String> getNameField() {
        return name;
    }

    public void setNameField(EncodedValue<String> name) {
        this.name = name;
    }

    /** Parent symbol for derived symbols, or null. */
    public String getExtends() {
        return extendsName.getValue();
    }

    public void setExtends(String parent) {
        this.extendsName = this.extendsName.withValue(parent);
    }

    public EncodedValue<String> getExtendsField() {
        return extendsName;
    }

    public void setExtendsField(EncodedValue<String> extendsName) {
        this.extendsName = extendsName;
    }

    public boolean isPinNumbersHidden() {
        return pinNumbersHide.getValue();
    }

    public void setPinNumbersHidden(boolean hidden) {
        this.pinNumbersHide = this.pinNumbersHide.withValue(hidden);
    }

    public EncodedValue<Boolean> getPinNumbersHideField() {
        return pinNumbersHide;
    }

    public void setPinNumbersHideField(EncodedValue<Boolean> pinNumbersHide) {
        this.pinNumbersHide = pinNumbersHide;
    }

    public ChildOrder getPinNumbersOrder() {
        return pinNumbersOrder;
    }

    public void setPinNumbersOrder(ChildOrder pinNumbersOrder) {
        this.pinNumbersOrder = pinNumbersOrder != null ? pinNumbersOrder : ChildOrder.empty();
    }

    public Coord getPinNamesOffset() {
        return pinNamesOffset.getValue();
    }

    public void setPinNamesOffset(Coord offset) {
        this.pinNamesOffset = this.pinNamesOffset.withValue(offset);
    }

    public EncodedValue<Coord> getPinNamesOffsetField() {
        return pinNamesOffset;
    }

    public void setPinNamesOffsetField(EncodedValue<Coord> pinNamesOffset) {
        this.pinNamesOffset = pinNamesOffset;
    }

    public boolean isPinNamesHidden() {
        return pinNamesHide.getValue();
    }

    public void setPinNamesHidden(boolean hidden) {
        this.pinNamesHide = this.pinNamesHide.withValue(hidden);
    }

    public EncodedValue<Boolean> getPinNamesHideField() {
        return pinNamesHide;
    }

    public void setPinNamesHideField(EncodedValue<Boolean> pinNamesHide) {
        this.pinNamesHide = pinNamesHide;
    }

    public ChildOrder getPinNamesOrder() {
        return pinNamesOrder;
    }

    public void setPinNamesOrder(ChildOrder pinNamesOrder) {
        this.pinNamesOrder = pinNamesOrder != null ? pinNamesOrder : ChildOrder.empty();
    }

    public boolean isExcludeFromSim() {
        return excludeFromSim.getValue();
    }

    public void setExcludeFromSim(boolean exclude) {
        this.excludeFromSim = this.excludeFromSim.withValue(exclude);
    }

    public EncodedValue<Boolean> getExcludeFromSimField() {
        return excludeFromSim;
    }

    public void setExcludeFromSimField(EncodedValue<Boolean> excludeFromSim) {
        this.excludeFromSim = excludeFromSim;
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

    /** Unit sub-symbols such as {@code (symbol "R_1_1" ...)}. */
    public List<SList> getUnits() {
        return getChildOrder().getUnmodeled("symbol");
    }

    public int getPinCount() {
        int count = 0;
        for (SList unit : getUnits()) {
            for (SNode child : unit.children()) {
                if (child instanceof SList list && list.hasTag("pin")) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "LibSymbol{" + name.getValue() + ", pins=" + getPinCount() + "}";
    }
}
