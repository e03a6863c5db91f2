package info.isaksson.erland.funcanalyzer.ir;

import java.util.List;

/**
 * Parsed type expression.
 *
 * <p>The set of node kinds is closed: a renderer handles exactly these five records.
 * All nodes are immutable; list components are defensively copied.</p>
 */
public sealed interface TypeExpr permits TypeExpr.NameRef, TypeExpr.QualifiedRef, TypeExpr.Subscript,
        TypeExpr.Literal, TypeExpr.UnionOp {

    /** A bare identifier, e.g. {@code int} or {@code MyClass}. */
    record NameRef(String identifier) implements TypeExpr {
        public NameRef {
            requireText(identifier, "identifier");
        }
    }

    /** Dotted access, e.g. {@code typing.Optional}. Always at least two segments. */
    record QualifiedRef(List<String> segments) implements TypeExpr {
        public QualifiedRef {
            if (segments == null || segments.size() < 2) {
                throw new IllegalArgumentException("qualified reference needs at least two segments: " + segments);
            }
            segments = List.copyOf(segments);
            for (String s : segments) requireText(s, "segment");
        }

        public String lastSegment() {
            return segments.get(segments.size() - 1);
        }
    }

    /** Generic application, e.g. {@code Dict[str, int]}. Argument order is significant. */
    record Subscript(TypeExpr base, List<TypeExpr> args) implements TypeExpr {
        public Subscript {
            if (base == null) throw new IllegalArgumentException("base is null");
            if (args == null || args.isEmpty()) throw new IllegalArgumentException("subscript needs arguments");
            args = List.copyOf(args);
        }
    }

    /** A constant inside an expression; {@code text} is its source spelling, e.g. {@code 'r'} or {@code None}. */
    record Literal(String text) implements TypeExpr {
        public Literal {
            requireText(text, "text");
        }
    }

    /** Binary union {@code left | right}. Chains nest to the left. */
    record UnionOp(TypeExpr left, TypeExpr right) implements TypeExpr {
        public UnionOp {
            if (left == null || right == null) throw new IllegalArgumentException("union operand is null");
        }

        /** Folds two or more members into a left-associative chain. */
        public static TypeExpr of(List<TypeExpr> members) {
            if (members == null || members.isEmpty()) throw new IllegalArgumentException("union needs members");
            TypeExpr acc = members.get(0);
            for (int i = 1; i < members.size(); i++) {
                acc = new UnionOp(acc, members.get(i));
            }
            return acc;
        }
    }

    private static void requireText(String s, String what) {
        if (s == null || s.isEmpty()) throw new IllegalArgumentException(what + " must not be empty");
    }
}
