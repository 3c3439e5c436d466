package nl.bytesoflife.deltakicad.model.sch;

import nl.bytesoflife.deltakicad.fidelity.ChildOrder;
import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.model.KiCadDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A {@code .kicad_sch} schematic sheet. */
public class Schematic extends KiCadDocument {

    public static final int DEFAULT_VERSION = 20231120;
    public static final String TOKEN = "kicad_sch";

    private EncodedValue<String> uuid = EncodedValue.absent(null);
    private EncodedValue<String> paper = EncodedValue.fresh("A4");
    private final List<LibSymbol> libSymbols = new ArrayList<>();
    private ChildOrder libSymbolsOrder = ChildOrder.empty();
    private final List<SchematicSymbol> symbols = new ArrayList<>();
    private final List<Wire> wires = new ArrayList<>();

    public Schematic() {
        super(DEFAULT_VERSION);
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

    public String getPaper() {
        return paper.getValue();
    }

    public void setPaper(String paper) {
        this.paper = this.paper.withValue(paper);
    }

    public EncodedValue<String> getPaperField() {
        return paper;
    }

    public void setPaperField(EncodedValue<String> paper) {
        this.paper = paper;
    }

    /** Copies of the library symbols used on this sheet. */
    public List<LibSymbol> getLibSymbols() {
        return Collections.unmodifiableList(libSymbols);
    }

    public void addLibSymbol(LibSymbol symbol) {
        libSymbols.add(symbol);
    }

    public LibSymbol getLibSymbol(String name) {
        for (LibSymbol symbol : libSymbols) {
            if (symbol.getName().equals(name)) {
                return symbol;
            }
        }
        return null;
    }

    public ChildOrder getLibSymbolsOrder() {
        return libSymbolsOrder;
    }

    public void setLibSymbolsOrder(ChildOrder libSymbolsOrder) {
        this.libSymbolsOrder = libSymbolsOrder != null ? libSymbolsOrder : ChildOrder.empty();
    }

    public List<SchematicSymbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public void addSymbol(SchematicSymbol symbol) {
        symbols.add(symbol);
    }

    public boolean removeSymbol(SchematicSymbol symbol) {
        return symbols.remove(symbol);
    }

    public List<Wire> getWires() {
        return Collections.unmodifiableList(wires);
    }

    public void addWire(Wire wire) {
        wires.add(wire);
    }

    public boolean removeWire(Wire wire) {
        return wires.remove(wire);
    }

    @Override
    public String toString() {
        return "Schematic{libSymbols=" + libSymbols.size() + ", symbols=" + symbols.size()
                + ", wires=" + wires.size() + "}";
    }
}
