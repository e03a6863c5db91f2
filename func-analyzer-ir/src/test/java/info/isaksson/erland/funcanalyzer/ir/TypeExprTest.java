package info.isaksson.erland.funcanalyzer.ir;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeExprTest {

    @Test
    void qualifiedRef_copiesSegments_andExposesLast() {
        List<String> chain = new ArrayList<>(List.of("outer", "inner", "MyType"));
        TypeExpr.QualifiedRef q = new TypeExpr.QualifiedRef(chain);
        chain.add("Mutated");

        assertEquals(3, q.segments().size());
        assertEquals("MyType", q.lastSegment());
        assertThrows(UnsupportedOperationException.class, () -> q.segments().add("x"));
    }

    @Test
    void qualifiedRef_requiresTwoSegments() {
        assertThrows(IllegalArgumentException.class, () -> new TypeExpr.QualifiedRef(List.of("single")));
        assertThrows(IllegalArgumentException.class, () -> new TypeExpr.QualifiedRef(List.of("a", "")));
    }

    @Test
    void subscript_rejectsMissingArgs() {
        TypeExpr base = new TypeExpr.NameRef("List");
        assertThrows(IllegalArgumentException.class, () -> new TypeExpr.Subscript(base, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new TypeExpr.Subscript(null, List.of(base)));
    }

    @Test
    void unionOf_foldsToTheLeft() {
        TypeExpr a = new TypeExpr.NameRef("a");
        TypeExpr b = new TypeExpr.NameRef("b");
        TypeExpr c = new TypeExpr.NameRef("c");

        TypeExpr u = TypeExpr.UnionOp.of(List.of(a, b, c));

        assertEquals(new TypeExpr.UnionOp(new TypeExpr.UnionOp(a, b), c), u);
        assertSame(a, TypeExpr.UnionOp.of(List.of(a)));
    }

    @Test
    void nodesAreValueEqual() {
        TypeExpr x = new TypeExpr.Subscript(new TypeExpr.NameRef("Dict"),
                List.of(new TypeExpr.NameRef("str"), new TypeExpr.Literal("'k'")));
        TypeExpr y = new TypeExpr.Subscript(new TypeExpr.NameRef("Dict"),
                List.of(new TypeExpr.NameRef("str"), new TypeExpr.Literal("'k'")));
        assertEquals(x, y);
        assertEquals(x.hashCode(), y.hashCode());
    }
}
