package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.model.pcb.Footprint;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

/** Writes {@code .kicad_mod} footprint files. */
public class FootprintWriter extends DocumentWriter<Footprint> {

    @Override
    public SList toTree(Footprint footprint) {
        return FootprintMapping.footprintNode(footprint, true);
    }
}
