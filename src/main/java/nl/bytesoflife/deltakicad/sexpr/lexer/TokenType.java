package nl.bytesoflife.deltakicad.sexpr.lexer;

public enum TokenType {
    OPEN_PAREN,
    CLOSE_PAREN,
    SYMBOL,
    STRING,
    EOF
}
