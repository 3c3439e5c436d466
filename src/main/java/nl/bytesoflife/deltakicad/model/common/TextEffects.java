package nl.bytesoflife.deltakicad.model.common;

import nl.bytesoflife.deltakicad.fidelity.ChildOrder;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.KiCadElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Text appearance: {@code (effects (font (size h w) (thickness t) bold italic)
 * (justify left) hide)}. KiCad 8 spells the flags as {@code (bold yes)} and
 * {@code (hide yes)}; each flag remembers which spelling it was read with.
 */
public class TextEffects extends KiCadElement {

    public static final CoordPoint DEFAULT_FONT_SIZE = new CoordPoint(Coord.fromMm("1.27"), Coord.fromMm("1.27"));

    private CoordPoint fontSize = DEFAULT_FONT_SIZE;
    private EncodedValue<Coord> thickness = EncodedValue.absent(null);
    private EncodedValue<Boolean> bold = EncodedValue.absent(Boolean.FALSE);
    private EncodedValue<Boolean> italic = EncodedValue.absent(Boolean.FALSE);
    private EncodedValue<Boolean> hide = EncodedValue.absent(Boolean.FALSE);
    private List<String> justify;
    private ChildOrder fontOrder = ChildOrder.empty();

    /** Font height and width; KiCad writes {@code (size height width)}. */
    public CoordPoint getFontSize() {
        return fontSize;
    }

    public void setFontSize(CoordPoint fontSize) {
        this.fontSize = fontSize;
    }

    public Coord getThickness() {
        return thickness.getValue();
    }

    public void setThickness(Coord thickness) {
        this.thickness = this.thickness.withValue(thickness);
    }

    public EncodedValue<Coord> getThicknessField() {
        return thickness;
    }

    public void setThicknessField(EncodedValue<Coord> thickness) {
        this.thickness = thickness;
    }

    public boolean isBold() {
        return bold.getValue();
    }

    public void setBold(boolean bold) {
        this.bold = this.bold.withValue(bold);
    }

    public EncodedValue<Boolean> getBoldField() {
        return bold;
    }

    public void setBoldField(EncodedValue<Boolean> bold) {
        this.bold = bold;
    }

    public boolean isItalic() {
        return italic.getValue();
    }

    public void setItalic(boolean italic) {
        this.italic = this.italic.withValue(italic);
    }

    public EncodedValue<Boolean> getItalicField() {
        return italic;
    }

    public void setItalicField(EncodedValue<Boolean> italic) {
        this.italic = italic;
    }

    public boolean isHidden() {
        return hide.getValue();
    }

    public void setHidden(boolean hidden) {
        this.hide = this.hide.withValue(hidden);
    }

    public EncodedValue<Boolean> getHideField() {
        return hide;
    }

    public void setHideField(EncodedValue<Boolean> hide) {
        this.hide = hide;
    }

    /** Justification keywords, or null when the text uses the default. */
    public List<String> getJustify() {
        return justify;
    }

    public void setJustify(List<String> justify) {
        this.justify = justify != null ? new ArrayList<>(justify) : null;
    }

    public ChildOrder getFontOrder() {
        return fontOrder;
    }

    public void setFontOrder(ChildOrder fontOrder) {
        this.fontOrder = fontOrder != null ? fontOrder : ChildOrder.empty();
    }
}
