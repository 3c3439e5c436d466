package nl.bytesoflife.deltakicad.sexpr.parser;

import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.ListLayout;
import nl.bytesoflife.deltakicad.sexpr.SExpressionFormat;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import nl.bytesoflife.deltakicad.sexpr.SNode.SAtom;
import nl.bytesoflife.deltakicad.sexpr.SNode.SList;
import nl.bytesoflife.deltakicad.sexpr.SNode.SNumber;
import nl.bytesoflife.deltakicad.sexpr.SNode.SString;
import nl.bytesoflife.deltakicad.sexpr.SNode.SSymbol;
import nl.bytesoflife.deltakicad.sexpr.SourceLocation;
import nl.bytesoflife.deltakicad.sexpr.lexer.SExpressionLexer;
import nl.bytesoflife.deltakicad.sexpr.lexer.Token;
import nl.bytesoflife.deltakicad.sexpr.lexer.TokenType;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds an S-expression tree from KiCad text.
 * <p>
 * Nesting is tracked on an explicit stack, so input depth is bounded by heap
 * rather than by the call stack. The parser never throws on malformed text:
 * problems become diagnostics and the best-effort tree is returned.
 */
public class SExpressionParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    public ParseResult parse(String text) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        SExpressionLexer lexer = new SExpressionLexer(text, diagnostics);
        Deque<Frame> stack = new ArrayDeque<>();
        SList root = null;
        SExpressionFormat format = null;

        while (lexer.hasNext()) {
            Token token = lexer.next();

            if (format == null && token.breaksBefore() > 0 && !stack.isEmpty()
                    && (token.is(TokenType.OPEN_PAREN) || token.is(TokenType.SYMBOL) || token.is(TokenType.STRING))) {
                format = detectFormat(token.indent(), stack.size());
            }

            switch (token.type()) {
                case OPEN_PAREN -> stack.push(new Frame(token.location(), token.breaksBefore()));
                case CLOSE_PAREN -> {
                    if (stack.isEmpty()) {
                        diagnostics.add(Diagnostic.error("Unexpected ')' with no open list", token.location()));
                        continue;
                    }
                    root = close(stack, token.breaksBefore(), root, diagnostics);
                }
                case SYMBOL, STRING -> {
                    SAtom atom = toAtom(token);
                    if (stack.isEmpty()) {
                        diagnostics.add(Diagnostic.error(
                                "Unexpected atom '" + token.text() + "' outside of a list", token.location()));
                    } else {
                        stack.peek().add(atom, token.breaksBefore());
                    }
                }
                case EOF -> {
                    if (!stack.isEmpty()) {
                        diagnostics.add(Diagnostic.error("Unexpected end of input: " + stack.size()
                                + " list(s) not closed, opened at " + stack.peek().location, token.location()));
                        while (!stack.isEmpty()) {
                            root = close(stack, 0, root, diagnostics);
                        }
                    }
                    if (root == null) {
                        diagnostics.add(Diagnostic.error("No S-expression list found", token.location()));
                        root = new SList(List.of());
                    }
                }
            }
        }

        return new ParseResult(root, diagnostics, format != null ? format : SExpressionFormat.KICAD_CURRENT);
    }

    private SList close(Deque<Frame> stack, int breaksBeforeClose, SList root, List<Diagnostic> diagnostics) {
        Frame frame = stack.pop();
        SList list = frame.toList(breaksBeforeClose);
        if (!stack.isEmpty()) {
            stack.peek().add(list, frame.breaksBeforeOpen);
            return root;
        }
        if (root != null) {
            diagnostics.add(Diagnostic.error("Unexpected content after the root expression", frame.location));
            return root;
        }
        return list;
    }

    static SAtom toAtom(Token token) {
        if (token.is(TokenType.STRING)) {
            return new SString(token.text(), token.raw());
        }
        return bareAtom(token.text());
    }

    /** Classifies unquoted text the way the parser does: number when numeric, symbol otherwise. */
    public static SAtom bareAtom(String text) {
        if (NUMBER.matcher(text).matches()) {
            return new SNumber(new BigDecimal(text), text);
        }
        return new SSymbol(text);
    }

    /** Indentation of the first line that starts at {@code depth}, or null when it is not a whole unit per level. */
    private static SExpressionFormat detectFormat(String indent, int depth) {
        if (indent.isEmpty()) {
            return null;
        }
        if (indent.charAt(0) == '\t') {
            return SExpressionFormat.KICAD_CURRENT;
        }
        int spaces = 0;
        while (spaces < indent.length() && indent.charAt(spaces) == ' ') {
            spaces++;
        }
        if (spaces == 0 || spaces % depth != 0) {
            return null;
        }
        return SExpressionFormat.spaces(spaces / depth);
    }

    private static final class Frame {
        private final SourceLocation location;
        private final int breaksBeforeOpen;
        private final List<SNode> children = new ArrayList<>();
        private final List<Integer> breaks = new ArrayList<>();

        Frame(SourceLocation location, int breaksBeforeOpen) {
            this.location = location;
            this.breaksBeforeOpen = breaksBeforeOpen;
        }

        void add(SNode node, int breaksBefore) {
            children.add(node);
            breaks.add(breaksBefore);
        }

        SList toList(int breaksBeforeClose) {
            return new SList(children, new ListLayout(breaks, breaksBeforeClose));
        }
    }
}
