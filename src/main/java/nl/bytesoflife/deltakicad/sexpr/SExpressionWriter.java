package nl.bytesoflife.deltakicad.sexpr;

import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Serializes S-expression trees in KiCad's formatting.
 * <p>
 * Lists that came out of the parser keep their captured line breaks, which is
 * what lets an untouched file come back byte for byte. Lists built in memory
 * use the canonical shape: atom-only lists on one line, nested lists on their
 * own lines one indent level deeper, closing paren aligned with the opener.
 * Output always ends with a single newline.
 */
public class SExpressionWriter {

    private final SExpressionFormat format;

    public SExpressionWriter() {
        this(SExpressionFormat.KICAD_CURRENT);
    }

    public SExpressionWriter(SExpressionFormat format) {
        this.format = format;
    }

    public SExpressionFormat getFormat() {
        return format;
    }

    public String write(SList root) {
        StringBuilder sb = new StringBuilder(4096);
        appendTree(sb, root);
        sb.append('\n');
        return sb.toString();
    }

    public void write(SList root, Writer out) throws IOException {
        out.write(write(root));
        out.flush();
    }

    /** Writes UTF-8 text to {@code out}; the stream is flushed but not closed. */
    public void write(SList root, OutputStream out) throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        write(root, writer);
    }

    private void appendTree(StringBuilder sb, SList root) {
        Deque<Frame> stack = new ArrayDeque<>();
        sb.append('(');
        stack.push(new Frame(root, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.index < frame.list.size()) {
                int i = frame.index++;
                SNode child = frame.list.get(i);
                appendSeparator(sb, frame, i, child);
                if (child instanceof SList list) {
                    sb.append('(');
                    stack.push(new Frame(list, frame.depth + 1));
                } else {
                    appendAtom(sb, (SAtom) child);
                }
            } else {
                appendClose(sb, frame);
                stack.pop();
            }
        }
    }

    private void appendSeparator(StringBuilder sb, Frame frame, int index, SNode child) {
        ListLayout layout = frame.list.layout();
        if (layout != null) {
            int breaks = layout.breaksBefore(index);
            if (breaks > 0) {
                newLines(sb, breaks, frame.depth + 1);
            } else if (index > 0) {
                sb.append(' ');
            }
            return;
        }

        if (index == 0) {
            return;
        }
        if (frame.multiLine && (child instanceof SList || frame.brokeLine)) {
            newLines(sb, 1, frame.depth + 1);
            frame.brokeLine = true;
        } else {
            sb.append(' ');
        }
    }

    private void appendClose(StringBuilder sb, Frame frame) {
        ListLayout layout = frame.list.layout();
        if (layout != null) {
            if (layout.breaksBeforeClose() > 0) {
                newLines(sb, layout.breaksBeforeClose(), frame.depth);
            }
        } else if (frame.multiLine) {
            newLines(sb, 1, frame.depth);
        }
        sb.append(')');
    }

    private void newLines(StringBuilder sb, int count, int depth) {
        for (int i = 0; i < count; i++) {
            sb.append('\n');
        }
        for (int i = 0; i < depth; i++) {
            sb.append(format.indentUnit());
        }
    }

    static void appendAtom(StringBuilder sb, SAtom atom) {
        if (atom instanceof SString string) {
            sb.append('"');
            if (string.originalText() != null) {
                sb.append(string.originalText());
            } else {
                appendEscaped(sb, string.value());
            }
            sb.append('"');
        } else if (atom instanceof SNumber number) {
            sb.append(number.text());
        } else if (atom instanceof SSymbol symbol) {
            sb.append(symbol.value());
        }
    }

    private static void appendEscaped(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
    }

    /** Quoted and escaped form of a string built in memory. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        appendAtom(sb, new SString(value));
        return sb.toString();
    }

    private static final class Frame {
        private final SList list;
        private final int depth;
        private final boolean multiLine;
        private int index;
        private boolean brokeLine;

        Frame(SList list, int depth) {
            this.list = list;
            this.depth = depth;
            this.multiLine = list.layout() == null && containsList(list);
        }

        private static boolean containsList(SList list) {
            for (int i = 1; i < list.size(); i++) {
                if (list.get(i) instanceof SList) {
                    return true;
                }
            }
            return false;
        }
    }
}
