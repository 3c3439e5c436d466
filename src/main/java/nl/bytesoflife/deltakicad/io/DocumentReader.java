package nl.bytesoflife.deltakicad.io;

import nl.bytesoflife.deltakicad.model.KiCadDocument;
import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.parser.ParseResult;
import nl.bytesoflife.deltakicad.sexpr.parser.SExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Parses KiCad text and maps the tree onto a document model. Text problems
 * and mapping problems end up in the document's diagnostics; only input that
 * cannot be this kind of document at all is rejected with an exception.
 */
public abstract class DocumentReader<T extends KiCadDocument> {

    private static final Logger log = LoggerFactory.getLogger(DocumentReader.class);

    private final SExpressionParser parser = new SExpressionParser();

    /** Human readable document kind for messages, e.g. {@code "footprint"}. */
    protected abstract String kind();

    protected abstract boolean acceptsRoot(String tag);

    /** Maps {@code root}, adding mapping problems to {@code diagnostics}. */
    protected abstract T map(SList root, List<Diagnostic> diagnostics);

    public T read(String text) throws KiCadFileException {
        long start = System.nanoTime();
        ParseResult result = parser.parse(text);
        SList root = result.root();

        if (root.size() == 0) {
            throw new KiCadFileException("No S-expression found in " + kind() + " input", 0);
        }
        if (!acceptsRoot(root.tag())) {
            throw new KiCadFileException("Expected a " + kind() + " but found root token '" + root.tag() + "'", 0);
        }

        List<Diagnostic> mapping = new ArrayList<>();
        T document = map(root, mapping);
        document.setFormat(result.format());
        document.addDiagnostics(result.diagnostics());
        document.addDiagnostics(mapping);

        if (document.hasErrors()) {
            List<Diagnostic> errors = document.getErrors();
            log.warn("Loaded {} with {} error(s), first: {}", kind(), errors.size(), errors.get(0));
        }
        log.debug("Read {} ({} chars) in {} ms", kind(), text.length(), (System.nanoTime() - start) / 1_000_000);
        return document;
    }

    /** Reads the whole stream as UTF-8. The stream is not closed. */
    public T read(InputStream in) throws KiCadFileException {
        String text;
        try {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KiCadFileException("Failed to read " + kind() + " stream", e);
        }
        return read(text);
    }

    public T read(Path path) throws KiCadFileException {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KiCadFileException("Failed to read " + kind() + " file " + path, path, null, e);
        }
        try {
            return read(text);
        } catch (KiCadFileException e) {
            throw e.withFilePath(path);
        }
    }

    /**
     * Reads on {@code executor}. A {@link KiCadFileException} completes the
     * future exceptionally, wrapped in a {@link CompletionException}.
     */
    public CompletableFuture<T> readAsync(InputStream in, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return read(in);
            } catch (KiCadFileException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
