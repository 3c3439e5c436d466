package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.fidelity.ChildOrder;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.BoundingBox;
import nl.bytesoflife.deltakicad.model.Coord;
import nl.bytesoflife.deltakicad.model.KiCadDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A {@code .kicad_pcb} board. */
public class Board extends KiCadDocument {

    public static final int DEFAULT_VERSION = 20240108;
    public static final String TOKEN = "kicad_pcb";

    private EncodedValue<Coord> thickness = EncodedValue.fresh(Coord.fromMm("1.6"));
    private ChildOrder generalOrder = ChildOrder.empty();
    private final List<Net> nets = new ArrayList<>();
    private final List<Footprint> footprints = new ArrayList<>();
    private final List<Track> tracks = new ArrayList<>();

    public Board() {
        super(DEFAULT_VERSION);
    }

    /** Board thickness from {@code (general (thickness ...))}. */
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

    /** Order of the children of {@code (general ...)}. */
    public ChildOrder getGeneralOrder() {
        return generalOrder;
    }

    public void setGeneralOrder(ChildOrder generalOrder) {
        this.generalOrder = generalOrder != null ? generalOrder : ChildOrder.empty();
    }

    public List<Net> getNets() {
        return Collections.unmodifiableList(nets);
    }

    public void addNet(Net net) {
        nets.add(net);
    }

    public Net getNet(int number) {
        for (Net net : nets) {
            if (net.number() == number) {
                return net;
            }
        }
        return null;
    }

    public Net getNet(String name) {
        for (Net net : nets) {
            if (net.name().equals(name)) {
                return net;
            }
        }
        return null;
    }

    public List<Footprint> getFootprints() {
        return Collections.unmodifiableList(footprints);
    }

    public void addFootprint(Footprint footprint) {
        footprints.add(footprint);
    }

    public boolean removeFootprint(Footprint footprint) {
        return footprints.remove(footprint);
    }

    public Footprint getFootprint(String reference) {
        for (Footprint footprint : footprints) {
            if (reference.equals(footprint.getReference())) {
                return footprint;
            }
        }
        return null;
    }

    public List<Track> getTracks() {
        return Collections.unmodifiableList(tracks);
    }

    public void addTrack(Track track) {
        tracks.add(track);
    }

    public boolean removeTrack(Track track) {
        return tracks.remove(track);
    }

    public List<Track> getTracks(int net) {
        return tracks.stream()
                .filter(t -> t.getNet() != null && t.getNet() == net)
                .toList();
    }

    /** Extent of all placed pads and tracks. */
    public BoundingBox getBoundingBox() {
        BoundingBox box = BoundingBox.empty();
        for (Footprint footprint : footprints) {
            box = box.expandToInclude(footprint.getPlacedBoundingBox());
        }
        for (Track track : tracks) {
            box = box.expandToInclude(track.getBoundingBox());
        }
        return box;
    }

    @Override
    public String toString() {
        return "Board{nets=" + nets.size() + ", footprints=" + footprints.size() + ", tracks=" + tracks.size() + "}";
    }
}
