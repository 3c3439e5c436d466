package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.fidelity.ConsumedNodes;
import nl.bytesoflife.deltakicad.fidelity.FlagStyle;
import nl.bytesoflife.deltakicad.model.sch.LibSymbol;
import nl.bytesoflife.deltakicad.model.sch.SymbolLibrary;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.List;

/** Reads {@code .kicad_sym} symbol libraries. */
public class SymbolLibraryReader extends DocumentReader<SymbolLibrary> {

    @Override
    protected String kind() {
        return "symbol library";
    }

    @Override
    protected boolean acceptsRoot(String tag) {
        return SymbolLibrary.TOKEN.equals(tag);
    }

    @Override
    protected SymbolLibrary map(SList root, List<Diagnostic> diagnostics) {
        SymbolLibrary library = new SymbolLibrary();
        ConsumedNodes consumed = new ConsumedNodes();
        CommonMapping.readHeader(root, library, consumed);
        FlagStyle hideStyle = CommonMapping.effectsHideStyle(library);

        for (SList child : root.children("symbol")) {
            LibSymbol symbol = SymbolMapping.readLibSymbol(child, hideStyle, diagnostics);
            if (symbol != null) {
                consumed.mark(child, symbol);
                library.addSymbol(symbol);
            }
        }

        library.setChildOrder(consumed.capture(root, 0));
        return library;
    }
}
