package nl.bytesoflife.deltakicad.sexpr.lexer;

import nl.bytesoflife.deltakicad.sexpr.SourceLocation;

/**
 * Lexical token.
 *
 * @param type          token kind
 * @param text          symbol text or decoded string content; empty for punctuation
 * @param raw           source spelling between the quotes for strings, otherwise the same as text
 * @param location      where the token starts
 * @param breaksBefore  number of line breaks in the whitespace preceding the token
 * @param indent        whitespace between the last preceding line break and the token
 */
public record Token(TokenType type, String text, String raw, SourceLocation location,
                    int breaksBefore, String indent) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        String shown = switch (type) {
            case OPEN_PAREN -> "(";
            case CLOSE_PAREN -> ")";
            case STRING -> '"' + raw + '"';
            case SYMBOL -> text;
            case EOF -> "<EOF>";
        };
        return shown + "@" + location;
    }
}
