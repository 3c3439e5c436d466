package nl.bytesoflife.deltakicad.sexpr.lexer;

import nl.bytesoflife.deltakicad.sexpr.Diagnostic;
import nl.bytesoflife.deltakicad.sexpr.SourceLocation;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexer for KiCad S-expression text.
 * Produces tokens lazily; the sequence ends with a single EOF token and
 * cannot be restarted. Lexical problems are reported to the diagnostics
 * list, never thrown.
 */
public class SExpressionLexer implements Iterator<Token> {

    private final String input;
    private final List<Diagnostic> diagnostics;

    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean finished;

    public SExpressionLexer(String input, List<Diagnostic> diagnostics) {
        this.input = input;
        this.diagnostics = diagnostics;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("Token stream already ended");
        }

        int breaks = 0;
        int indentStart = pos;
        while (pos < input.length() && isWhitespace(input.charAt(pos))) {
            if (input.charAt(pos) == '\n') {
                breaks++;
                indentStart = pos + 1;
            }
            advance();
        }
        String indent = breaks > 0 ? input.substring(indentStart, pos).replace("\r", "") : "";

        SourceLocation location = new SourceLocation(line, column, pos);
        if (pos >= input.length()) {
            finished = true;
            return new Token(TokenType.EOF, "", "", location, breaks, indent);
        }

        char c = input.charAt(pos);
        if (c == '(') {
            advance();
            return new Token(TokenType.OPEN_PAREN, "(", "(", location, breaks, indent);
        } else if (c == ')') {
            advance();
            return new Token(TokenType.CLOSE_PAREN, ")", ")", location, breaks, indent);
        } else if (c == '"') {
            return readString(location, breaks, indent);
        }
        return readSymbol(location, breaks, indent);
    }

    private Token readSymbol(SourceLocation location, int breaks, String indent) {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || isWhitespace(c)) {
                break;
            }
            advance();
        }
        String text = input.substring(start, pos);
        return new Token(TokenType.SYMBOL, text, text, location, breaks, indent);
    }

    private Token readString(SourceLocation location, int breaks, String indent) {
        advance(); // opening quote
        int rawStart = pos;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                String raw = input.substring(rawStart, pos);
                advance();
                return new Token(TokenType.STRING, sb.toString(), raw, location, breaks, indent);
            }
            if (c == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(unescape(input.charAt(pos)));
            } else {
                sb.append(c);
            }
            advance();
        }

        diagnostics.add(Diagnostic.error("Unterminated string", location));
        return new Token(TokenType.STRING, sb.toString(), input.substring(rawStart), location, breaks, indent);
    }

    private static char unescape(char escaped) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> escaped;
        };
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
