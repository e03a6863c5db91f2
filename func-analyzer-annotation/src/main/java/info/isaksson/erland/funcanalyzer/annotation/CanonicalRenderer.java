package info.isaksson.erland.funcanalyzer.annotation;

import info.isaksson.erland.funcanalyzer.ir.TypeExpr;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Serializes a {@link TypeExpr} without namespace qualifiers.
 *
 * <p>Dotted references keep only their last segment, subscript arguments are joined with
 * {@code ", "} and unions with {@code " | "}. Rendering is deterministic.</p>
 */
public final class CanonicalRenderer {

    private CanonicalRenderer() {}

    public static String render(TypeExpr expr) {
        return render(new StringBuilder(), expr).toString();
    }

    private static StringBuilder render(StringBuilder sb, TypeExpr expr) {
        if (expr instanceof TypeExpr.NameRef n) {
            return sb.append(n.identifier());
        } else if (expr instanceof TypeExpr.QualifiedRef q) {
            return sb.append(q.lastSegment());
        } else if (expr instanceof TypeExpr.Subscript s) {
            render(sb, s.base()).append('[');
            boolean first = true;
            for (TypeExpr arg : s.args()) {
                if (!first) sb.append(", ");
                first = false;
                render(sb, arg);
            }
            return sb.append(']');
        } else if (expr instanceof TypeExpr.Literal l) {
            return sb.append(l.text());
        } else if (expr instanceof TypeExpr.UnionOp u) {
            // walk the left spine iteratively; long a | b | c ... chains nest to the left
            Deque<TypeExpr> members = new ArrayDeque<>();
            TypeExpr cur = u;
            while (cur instanceof TypeExpr.UnionOp link) {
                members.push(link.right());
                cur = link.left();
            }
            members.push(cur);
            boolean first = true;
            for (TypeExpr m : members) {
                if (!first) sb.append(" | ");
                first = false;
                render(sb, m);
            }
            return sb;
        }
        throw new IllegalArgumentException("Unsupported type expression node: " + expr);
    }
}
