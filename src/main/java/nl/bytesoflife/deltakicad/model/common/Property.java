package nl.bytesoflife.deltakicad.model.common;

import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.KiCadElement;

/**
 * Key/value field such as {@code Reference} or {@code Value}, as written by
 * {@code (property "Key" "Value" (at ...) (effects ...))}.
 */
public class Property extends KiCadElement {

    private String key;
    private String value;
    private Position position;
    private EncodedValue<String> layer = EncodedValue.absent(null);
    private EncodedValue<String> uuid = EncodedValue.absent(null);
    private EncodedValue<Boolean> hide = EncodedValue.absent(Boolean.FALSE);
    private TextEffects effects;
    private FlagStyle effectsHideStyle;

    public Property(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
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

    public String getUuid() {
        return uuid.getValue();
    }

    public EncodedValue<String> getUuidField() {
        return uuid;
    }

    public void setUuidField(EncodedValue<String> uuid) {
        this.uuid = uuid;
    }

    /** Hidden on the property itself (KiCad 8 boards) or in its effects (schematics). */
    public boolean isHidden() {
        return hide.getValue() || (effects != null && effects.isHidden());
    }

    /**
     * Shows or hides the property wherever the file keeps the flag: in the
     * effects when it was read from there or when the property belongs to a
     * schematic or symbol, otherwise on the property itself.
     */
    public void setHidden(boolean hidden) {
        boolean inEffects = effectsHideStyle != null || (effects != null && effects.getHideField().isExplicit());
        if (inEffects) {
            if (effects == null) {
                effects = new TextEffects();
            }
            if (!effects.getHideField().isExplicit() && effectsHideStyle != null) {
                effects.setHideField(effects.getHideField().withFlagStyle(effectsHideStyle));
            }
            effects.setHidden(hidden);
        }
        if (!inEffects || !hidden) {
            hide = hide.withValue(hidden);
        }
    }

    public EncodedValue<Boolean> getHideField() {
        return hide;
    }

    public void setHideField(EncodedValue<Boolean> hide) {
        this.hide = hide;
    }

    /**
     * Spelling of a hide flag that is added to the effects: bare {@code hide}
     * before KiCad 8, {@code (hide yes)} after. Null when a new flag goes on
     * the property itself, as on KiCad 8 boards.
     */
    public FlagStyle getEffectsHideStyle() {
        return effectsHideStyle;
    }

    public void setEffectsHideStyle(FlagStyle effectsHideStyle) {
        this.effectsHideStyle = effectsHideStyle;
    }

    public TextEffects getEffects() {
        return effects;
    }

    public void setEffects(TextEffects effects) {
        this.effects = effects;
    }

    @Override
    public String toString() {
        return "Property{" + key + "=" + value + "}";
    }
}
