package nl.bytesoflife.deltakicad.model.sch;

import nl.bytesoflife.deltakicad.model.KiCadDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A {@code .kicad_sym} symbol library. */
public class SymbolLibrary extends KiCadDocument {

    public static final int DEFAULT_VERSION = 20231120;
    public static final String TOKEN = "kicad_symbol_lib";

    private final List<LibSymbol> symbols = new ArrayList<>();

    public SymbolLibrary() {
        super(DEFAULT_VERSION);
    }

    public List<LibSymbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public void addSymbol(LibSymbol symbol) {
        symbols.add(symbol);
    }

    public boolean removeSymbol(LibSymbol symbol) {
        return symbols.remove(symbol);
    }

    public LibSymbol getSymbol(String name) {
        for (LibSymbol symbol : symbols) {
            if (symbol.getName().equals(name)) {
                return symbol;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "SymbolLibrary{symbols=" + symbols.size() + "}";
    }
}
