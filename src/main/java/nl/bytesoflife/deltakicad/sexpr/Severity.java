package nl.bytesoflife.deltakicad.sexpr;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
