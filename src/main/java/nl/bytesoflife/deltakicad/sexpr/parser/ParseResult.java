package nl.bytesoflife.deltakicad.sexpr.parser;

import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SExpressionFormat;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;

import java.util.List;

/**
 * Outcome of parsing: the root list (best effort when the text was malformed),
 * the diagnostics in source order and the indentation detected in the text.
 */
public record ParseResult(SList root, List<Diagnostic> diagnostics, SExpressionFormat format) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return Diagnostic.anyErrors(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream()
                .filter(Diagnostic::isError)
                .toList();
    }
}
