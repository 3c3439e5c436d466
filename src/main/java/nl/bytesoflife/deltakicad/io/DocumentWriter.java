package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.model.KiCadDocument;
import nl.bytesoflife.deltakicad.sexpr.SExpressionWriter;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns a document model back into KiCad text, using the indentation the
 * document was loaded with.
 */
public abstract class DocumentWriter<T extends KiCadDocument> {

    private static final Logger log = LoggerFactory.getLogger(DocumentWriter.class);

    /** Builds the tree for {@code document}. */
    public abstract SList toTree(T document);

    public String write(T document) {
        long start = System.nanoTime();
        String text = new SExpressionWriter(document.getFormat()).write(toTree(document));
        log.debug("Wrote {} ({} chars) in {} ms", document.getClass().getSimpleName(), text.length(),
                (System.nanoTime() - start) / 1_000_000);
        return text;
    }

    /** Writes UTF-8 text to {@code out}; the stream is flushed but not closed. */
    public void write(T document, OutputStream out) throws KiCadFileException {
        String text = write(document);
        try {
            out.write(text.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new KiCadFileException("Failed to write " + document.getClass().getSimpleName(), e);
        }
    }

    public void write(T document, Path path) throws KiCadFileException {
        String text = write(document);
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KiCadFileException("Failed to write " + path, path, null, e);
        }
    }

    public CompletableFuture<Void> writeAsync(T document, OutputStream out, Executor executor) {
        return CompletableFuture.runAsync(() -> {
            try {
                write(document, out);
            } catch (KiCadFileException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
