package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.BoundingBox;
import nl.bytesoflife.deltakicad.model.CoordPoint;
import nl.bytesoflife.deltakicad.model.KiCadDocument;
import nl.bytesoflife.deltakicad.model.common.Position;
import nl.bytesoflife.deltakicad.model.common.Property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A footprint, either as a {@code .kicad_mod} file or placed on a board.
 * Files older than KiCad 6 use the root token {@code module}, which is kept.
 */
public class Footprint extends KiCadDocument {

    public static final int DEFAULT_VERSION = 20240108;
    public static final String TOKEN = "footprint";
    public static final String LEGACY_TOKEN = "module";

    private String token = TOKEN;
    private EncodedValue<String> name;
    private EncodedValue<Boolean> locked = EncodedValue.absent(Boolean.FALSE);
    private EncodedValue<String> layer = EncodedValue.fresh("F.Cu");
    private EncodedValue<String> description = EncodedValue.absent(null);
    private EncodedValue<String> tags = EncodedValue.absent(null);
    private Position position;
    private EncodedValue<String> uuid = EncodedValue.absent(null);
    private List<String> attributes;
    private final List<Property> properties = new ArrayList<>();
    private final List<Pad> pads = new ArrayList<>();

    public Footprint(String name) {
        super(DEFAULT_VERSION);
        this.name = EncodedValue.fresh(name);
    }

    /** {@code footprint}, or {@code module} for files that used it. */
    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
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

    public String getDescription() {
        return description.getValue();
    }

    public void setDescription(String description) {
        this.description = this.description.withValue(description);
    }

    public EncodedValue<String> getDescriptionField() {
        return description;
    }

    public void setDescriptionField(EncodedValue<String> description) {
        this.description = description;
    }

    public String getTags() {
        return tags.getValue();
    }

    public void setTags(String tags) {
        this.tags = this.tags.withValue(tags);
    }

    public EncodedValue<String> getTagsField() {
        return tags;
    }

    public void setTagsField(EncodedValue<String> tags) {
        this.tags = tags;
    }

    /** Placement on the board; null for library footprints that do not state it. */
    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
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

    /** Keywords of {@code (attr ...)}, or null when the footprint has none. */
    public List<String> getAttributes() {
        return attributes;
    }

    public void setAttributes(List<String> attributes) {
        this.attributes = attributes != null ? new ArrayList<>(attributes) : null;
    }

    public List<Property> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public void addProperty(Property property) {
        properties.add(property);
    }

    public boolean removeProperty(Property property) {
        return properties.remove(property);
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

    public List<Pad> getPads() {
        return Collections.unmodifiableList(pads);
    }

    public void addPad(Pad pad) {
        pads.add(pad);
    }

    public boolean removePad(Pad pad) {
        return pads.remove(pad);
    }

    /** Pad extent in the footprint's own coordinates. */
    public BoundingBox getBoundingBox() {
        BoundingBox box = BoundingBox.empty();
        for (Pad pad : pads) {
            box = box.expandToInclude(pad.getBoundingBox());
        }
        return box;
    }

    /**
     * Pad extent in board coordinates. Pad positions are rotated by the
     * footprint angle and moved to the footprint position; pad angles are
     * absolute, as KiCad stores them on a board.
     */
    public BoundingBox getPlacedBoundingBox() {
        if (position == null) {
            return getBoundingBox();
        }
        double angle = position.angleOrZero();
        BoundingBox box = BoundingBox.empty();
        for (Pad pad : pads) {
            if (pad.getPosition() == null || pad.getSize() == null) {
                continue;
            }
            CoordPoint center = pad.getPosition().toPoint().rotated(angle).plus(position.toPoint());
            box = box.expandToInclude(BoundingBox.ofRotatedRect(center, pad.getSize(), pad.getPosition().angleOrZero()));
        }
        return box;
    }

    @Override
    public String toString() {
        return "Footprint{" + name.getValue() + ", pads=" + pads.size() + "}";
    }
}
