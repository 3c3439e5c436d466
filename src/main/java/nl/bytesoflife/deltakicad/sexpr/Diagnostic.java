package nl.bytesoflife.deltakicad.sexpr;

import java.util.List;
import java.util.Objects;

/**
 * Problem found while reading a document. Diagnostics are collected instead
 * of thrown; {@code location} is null when the problem has no text position.
 */
public record Diagnostic(Severity severity, String message, SourceLocation location) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic error(String message, SourceLocation location) {
        return new Diagnostic(Severity.ERROR, message, location);
    }

    public static Diagnostic warning(String message, SourceLocation location) {
        return new Diagnostic(Severity.WARNING, message, location);
    }

    public static Diagnostic info(String message, SourceLocation location) {
        return new Diagnostic(Severity.INFO, message, location);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public static boolean anyErrors(List<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        if (location != null) {
            sb.append(location).append(": ");
        }
        sb.append(message);
        return sb.toString();
    }
}
