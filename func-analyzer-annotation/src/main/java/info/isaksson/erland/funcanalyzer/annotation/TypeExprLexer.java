package info.isaksson.erland.funcanalyzer.annotation;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a type expression into tokens.
 *
 * <p>Whitespace is skipped. A line break is only allowed inside brackets or parentheses;
 * outside of them it would start a second statement, which is rejected.</p>
 */
final class TypeExprLexer {

    private final String src;
    private int pos;
    private int depth;

    private TypeExprLexer(String src) {
        this.src = src;
    }

    static List<Token> tokenize(String src) throws TypeExprParseException {
        return new TypeExprLexer(src).run();
    }

    private List<Token> run() throws TypeExprParseException {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                out.add(new Token(Token.Kind.EOF, "", pos));
                return out;
            }
            out.add(next());
        }
    }

    private void skipWhitespace() throws TypeExprParseException {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n' || c == '\r') {
                if (depth == 0) throw new TypeExprParseException("Multiple statements are not supported", pos);
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else {
                return;
            }
        }
    }

    private Token next() throws TypeExprParseException {
        int start = pos;
        char c = src.charAt(pos);

        if (isIdentStart(c)) {
            pos++;
            while (pos < src.length() && isIdentPart(src.charAt(pos))) pos++;
            return token(Token.Kind.IDENT, start);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }
        if (src.startsWith("...", pos)) {
            pos += 3;
            return token(Token.Kind.ELLIPSIS, start);
        }

        pos++;
        switch (c) {
            case '.':
                return token(Token.Kind.DOT, start);
            case ',':
                return token(Token.Kind.COMMA, start);
            case '|':
                return token(Token.Kind.PIPE, start);
            case '[':
                depth++;
                return token(Token.Kind.LBRACKET, start);
            case ']':
                depth = Math.max(0, depth - 1);
                return token(Token.Kind.RBRACKET, start);
            case '(':
                depth++;
                return token(Token.Kind.LPAREN, start);
            case ')':
                depth = Math.max(0, depth - 1);
                return token(Token.Kind.RPAREN, start);
            default:
                throw new TypeExprParseException("Unexpected character '" + c + "'", start);
        }
    }

    private Token number(int start) throws TypeExprParseException {
        digits();
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            digits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
            int expStart = pos;
            digits();
            if (pos == expStart) throw new TypeExprParseException("Malformed number exponent", start);
        }
        // 1abc is not a number followed by a name
        if (pos < src.length() && isIdentPart(src.charAt(pos))) {
            throw new TypeExprParseException("Malformed number", start);
        }
        return token(Token.Kind.NUMBER, start);
    }

    private void digits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
    }

    private Token string(int start, char quote) throws TypeExprParseException {
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\n') break;
            pos++;
            if (c == quote) return token(Token.Kind.STRING, start);
        }
        throw new TypeExprParseException("Unterminated string literal", start);
    }

    private Token token(Token.Kind kind, int start) {
        return new Token(kind, src.substring(start, pos), start);
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
