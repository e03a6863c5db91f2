package info.isaksson.erland.funcanalyzer.annotation;

import info.isaksson.erland.funcanalyzer.ir.TypeExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for stringified type annotations.
 *
 * <p>Accepted shapes: identifiers, dotted chains, subscripts ({@code X[a, b]}), unions
 * ({@code a | b}), parenthesized grouping and constants (numbers, quoted strings,
 * {@code None}/{@code True}/{@code False}, {@code ...}). Anything else (calls, lists, tuples,
 * other operators, attribute access on a subscript) is rejected so the caller can fall back.</p>
 *
 * <p>{@code Union[a, b, c]} is read as the union chain {@code a | b | c}, so both spellings
 * of a union render the same way.</p>
 */
public final class TypeExprParser {

    /** Maximum nesting of subscripts, unions and parentheses. */
    public static final int MAX_DEPTH = 200;

    private static final Set<String> SINGLETONS = Set.of("None", "True", "False");
    private static final String UNION = "Union";

    private final List<Token> tokens;
    private int index;
    private int depth;

    private TypeExprParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete expression.
     *
     * @throws TypeExprParseException if the text is blank, malformed, or not one of the supported shapes
     */
    public static TypeExpr parse(String text) throws TypeExprParseException {
        if (text == null || text.isBlank()) {
            throw new TypeExprParseException("Empty expression", 0);
        }
        TypeExprParser p = new TypeExprParser(TypeExprLexer.tokenize(text));
        TypeExpr root = p.expression();
        p.expect(Token.Kind.EOF, "end of expression");
        return root;
    }

    private TypeExpr expression() throws TypeExprParseException {
        enter();
        TypeExpr left = primary();
        while (peek().is(Token.Kind.PIPE)) {
            advance();
            left = new TypeExpr.UnionOp(left, primary());
        }
        depth--;
        return left;
    }

    private TypeExpr primary() throws TypeExprParseException {
        TypeExpr base = atom();
        int saved = depth;
        while (peek().is(Token.Kind.LBRACKET)) {
            enter();
            Token open = advance();
            if (base instanceof TypeExpr.Literal || base instanceof TypeExpr.UnionOp) {
                throw new TypeExprParseException("Cannot subscript " + describe(base), open.start());
            }
            List<TypeExpr> args = arguments(open);
            base = isUnionName(base) ? TypeExpr.UnionOp.of(args) : new TypeExpr.Subscript(base, args);
        }
        depth = saved;
        return base;
    }

    private List<TypeExpr> arguments(Token open) throws TypeExprParseException {
        if (peek().is(Token.Kind.RBRACKET)) {
            throw new TypeExprParseException("Empty subscript", open.start());
        }
        List<TypeExpr> args = new ArrayList<>();
        while (true) {
            args.add(expression());
            if (peek().is(Token.Kind.COMMA)) {
                advance();
                if (peek().is(Token.Kind.RBRACKET)) break; // trailing comma
                continue;
            }
            break;
        }
        expect(Token.Kind.RBRACKET, "']'");
        return args;
    }

    private TypeExpr atom() throws TypeExprParseException {
        Token t = advance();
        switch (t.kind()) {
            case IDENT:
                if (SINGLETONS.contains(t.text())) return new TypeExpr.Literal(t.text());
                return nameOrChain(t);
            case NUMBER:
            case STRING:
            case ELLIPSIS:
                return new TypeExpr.Literal(t.text());
            case LPAREN:
                return parenthesized(t);
            case LBRACKET:
                throw new TypeExprParseException("List expressions are not supported", t.start());
            case EOF:
                throw new TypeExprParseException("Unexpected end of expression", t.start());
            default:
                throw new TypeExprParseException("Unexpected token '" + t.text() + "'", t.start());
        }
    }

    private TypeExpr nameOrChain(Token first) throws TypeExprParseException {
        if (!peek().is(Token.Kind.DOT)) return new TypeExpr.NameRef(first.text());
        List<String> segments = new ArrayList<>();
        segments.add(first.text());
        while (peek().is(Token.Kind.DOT)) {
            advance();
            Token seg = expect(Token.Kind.IDENT, "identifier after '.'");
            segments.add(seg.text());
        }
        return new TypeExpr.QualifiedRef(segments);
    }

    private TypeExpr parenthesized(Token open) throws TypeExprParseException {
        if (peek().is(Token.Kind.RPAREN)) {
            throw new TypeExprParseException("Tuples are not supported", open.start());
        }
        TypeExpr inner = expression();
        if (peek().is(Token.Kind.COMMA)) {
            throw new TypeExprParseException("Tuples are not supported", peek().start());
        }
        expect(Token.Kind.RPAREN, "')'");
        return inner;
    }

    private static boolean isUnionName(TypeExpr base) {
        if (base instanceof TypeExpr.NameRef n) return UNION.equals(n.identifier());
        if (base instanceof TypeExpr.QualifiedRef q) return UNION.equals(q.lastSegment());
        return false;
    }

    private static String describe(TypeExpr e) {
        return e instanceof TypeExpr.Literal ? "a literal" : "a union";
    }

    private void enter() throws TypeExprParseException {
        if (++depth > MAX_DEPTH) {
            throw new TypeExprParseException("Expression nested too deeply", peek().start());
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (!t.is(Token.Kind.EOF)) index++;
        return t;
    }

    private Token expect(Token.Kind kind, String what) throws TypeExprParseException {
        Token t = peek();
        if (!t.is(kind)) {
            String found = t.is(Token.Kind.EOF) ? "end of expression" : "'" + t.text() + "'";
            throw new TypeExprParseException("Expected " + what + " but found " + found, t.start());
        }
        return advance();
    }
}
