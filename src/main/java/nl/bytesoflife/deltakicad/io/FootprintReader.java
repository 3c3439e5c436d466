package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.model.pcb.Footprint;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.List;

/** Reads {@code .kicad_mod} footprint files, including pre-KiCad 6 {@code module} files. */
public class FootprintReader extends DocumentReader<Footprint> {

    @Override
    protected String kind() {
        return "footprint";
    }

    @Override
    protected boolean acceptsRoot(String tag) {
        return Footprint.TOKEN.equals(tag) || Footprint.LEGACY_TOKEN.equals(tag);
    }

    @Override
    protected Footprint map(SList root, List<Diagnostic> diagnostics) {
        return FootprintMapping.readFootprint(root, true, diagnostics);
    }
}
