package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.fidelity.EncodedValue;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SExpressionFormat;
import nl.bytesoflife.deltakicad.sexpr.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Common header of the four KiCad file kinds: file format version, the
 * generator that wrote it, and what went wrong while loading it.
 */
public abstract class KiCadDocument extends KiCadElement {

    public static final String GENERATOR = "delta_kicad";

    private EncodedValue<Integer> version;
    private EncodedValue<String> generator = EncodedValue.fresh(GENERATOR);
    private EncodedValue<String> generatorVersion = EncodedValue.absent(null);
    private SExpressionFormat format = SExpressionFormat.KICAD_CURRENT;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    protected KiCadDocument(int defaultVersion) {
        this.version = EncodedValue.fresh(defaultVersion);
    }

    public Integer getVersion() {
        return version.getValue();
    }

    public void setVersion(Integer version) {
        this.version = this.version.withValue(version);
    }

    public EncodedValue<Integer> getVersionField() {
        return version;
    }

    public void setVersionField(EncodedValue<Integer> version) {
        this.version = version;
    }

    public String getGenerator() {
        return generator.getValue();
    }

    public void setGenerator(String generator) {
        this.generator = this.generator.withValue(generator);
    }

    public EncodedValue<String> getGeneratorField() {
        return generator;
    }

    public void setGeneratorField(EncodedValue<String> generator) {
        this.generator = generator;
    }

    public String getGeneratorVersion() {
        return generatorVersion.getValue();
    }

    public void setGeneratorVersion(String generatorVersion) {
        this.generatorVersion = this.generatorVersion.withValue(generatorVersion);
    }

    public EncodedValue<String> getGeneratorVersionField() {
        return generatorVersion;
    }

    public void setGeneratorVersionField(EncodedValue<String> generatorVersion) {
        this.generatorVersion = generatorVersion;
    }

    /** Indentation used when the document is written; detected on load. */
    public SExpressionFormat getFormat() {
        return format;
    }

    public void setFormat(SExpressionFormat format) {
        this.format = format;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addDiagnostics(List<Diagnostic> diagnostics) {
        this.diagnostics.addAll(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.severity() == Severity.ERROR)
                .toList();
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.severity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return Diagnostic.anyErrors(diagnostics);
    }
}
