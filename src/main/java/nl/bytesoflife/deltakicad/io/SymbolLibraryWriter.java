package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.model.sch.LibSymbol;
import nl.bytesoflife.deltakicad.model.sch.SymbolLibrary;
import nl.bytesoflife.deltakicad.sexpr.SExpressionBuilder;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.LinkedHashMap;
import java.util.Map;

/** Writes {@code .kicad_sym} symbol libraries. */
public class SymbolLibraryWriter extends DocumentWriter<SymbolLibrary> {

    @Override
    public SList toTree(SymbolLibrary library) {
        Map<Object, SNode> fields = new LinkedHashMap<>();
        CommonMapping.putHeader(fields, library);
        for (LibSymbol symbol : library.getSymbols()) {
            fields.put(symbol, SymbolMapping.libSymbolNode(symbol));
        }

        SExpressionBuilder b = SExpressionBuilder.create(SymbolLibrary.TOKEN);
        library.getChildOrder().emit(b, fields);
        return b.build();
    }
}
