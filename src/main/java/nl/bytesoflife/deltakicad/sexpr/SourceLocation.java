package nl.bytesoflife.deltakicad.sexpr;

/**
 * Position in the source text. Line and column are 1-based, offset is the
 * 0-based character index.
 */
public record SourceLocation(int line, int column, int offset) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
