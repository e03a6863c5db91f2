package info.isaksson.erland.funcanalyzer.annotation;

/** Lexical token of a type expression; {@code text} is the exact source slice. */
record Token(Kind kind, String text, int start) {

    enum Kind {
        IDENT,
        NUMBER,
        STRING,
        ELLIPSIS,
        DOT,
        LBRACKET,
        RBRACKET,
        LPAREN,
        RPAREN,
        COMMA,
        PIPE,
        EOF
    }

    boolean is(Kind k) {
        return kind == k;
    }
}
