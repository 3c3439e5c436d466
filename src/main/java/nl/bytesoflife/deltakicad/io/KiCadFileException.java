package nl.bytesoflife.deltakicad.io;

import java.nio.file.Path;

/**
 * Thrown when input cannot be used as the requested kind of KiCad document:
 * it holds no S-expression, it has the wrong root token, or the stream could
 * not be read or written. Problems inside an otherwise usable document are
 * reported as diagnostics instead.
 */
public class KiCadFileException extends Exception {

    private final Path filePath;
    private final Integer position;

    public KiCadFileException(String message) {
        this(message, null, null, null);
    }

    public KiCadFileException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public KiCadFileException(String message, Integer position) {
        this(message, null, position, null);
    }

    public KiCadFileException(String message, Path filePath, Integer position, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
        this.position = position;
    }

    /** File involved, or null for strings and streams. */
    public Path getFilePath() {
        return filePath;
    }

    /** Character offset of the problem in the input, or null when unknown. */
    public Integer getPosition() {
        return position;
    }

    KiCadFileException withFilePath(Path path) {
        KiCadFileException e = new KiCadFileException(getMessage() + " (" + path + ")", path, position, getCause());
        e.setStackTrace(getStackTrace());
        return e;
    }
}
