package info.isaksson.erland.funcanalyzer.annotation;

import info.isaksson.erland.funcanalyzer.ir.TypeExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeExprParserTest {

    @Test
    void parsesBareName() throws Exception {
        assertEquals(new TypeExpr.NameRef("int"), TypeExprParser.parse("int"));
    }

    @Test
    void parsesDottedChain() throws Exception {
        TypeExpr e = TypeExprParser.parse("outer.inner.MyType");
        assertEquals(new TypeExpr.QualifiedRef(List.of("outer", "inner", "MyType")), e);
    }

    @Test
    void parsesSubscriptWithOrderedArgs() throws Exception {
        TypeExpr e = TypeExprParser.parse("typing.Dict[str, typing.List[int]]");

        TypeExpr.Subscript s = assertInstanceOf(TypeExpr.Subscript.class, e);
        assertEquals(new TypeExpr.QualifiedRef(List.of("typing", "Dict")), s.base());
        assertEquals(2, s.args().size());
        assertEquals(new TypeExpr.NameRef("str"), s.args().get(0));
        assertInstanceOf(TypeExpr.Subscript.class, s.args().get(1));
    }

    @Test
    void unionOperatorIsLeftAssociative() throws Exception {
        TypeExpr e = TypeExprParser.parse("a | b | c");
        TypeExpr a = new TypeExpr.NameRef("a");
        TypeExpr b = new TypeExpr.NameRef("b");
        TypeExpr c = new TypeExpr.NameRef("c");
        assertEquals(new TypeExpr.UnionOp(new TypeExpr.UnionOp(a, b), c), e);
    }

    @Test
    void unionSubscriptBecomesUnionChain() throws Exception {
        assertEquals(TypeExprParser.parse("str | int | float"), TypeExprParser.parse("Union[str, int, float]"));
        assertEquals(TypeExprParser.parse("str | None"), TypeExprParser.parse("typing.Union[str, None]"));
        assertEquals(new TypeExpr.NameRef("str"), TypeExprParser.parse("Union[str]"));
    }

    @Test
    void parsesLiteralsWithSourceSpelling() throws Exception {
        TypeExpr.Subscript s = (TypeExpr.Subscript) TypeExprParser.parse("Literal['r', \"w\", 3, 1.5e3, None, True]");
        List<String> texts = s.args().stream().map(a -> ((TypeExpr.Literal) a).text()).toList();
        assertEquals(List.of("'r'", "\"w\"", "3", "1.5e3", "None", "True"), texts);
    }

    @Test
    void parsesEllipsisAndTrailingComma() throws Exception {
        TypeExpr.Subscript s = (TypeExpr.Subscript) TypeExprParser.parse("Tuple[int, ...,]");
        assertEquals(List.of(new TypeExpr.NameRef("int"), new TypeExpr.Literal("...")), s.args());
    }

    @Test
    void groupingParenthesesAreTransparent() throws Exception {
        assertEquals(TypeExprParser.parse("a | b"), TypeExprParser.parse("(a | b)"));
    }

    @Test
    void newlinesInsideBracketsAreAllowed() throws Exception {
        assertInstanceOf(TypeExpr.Subscript.class, TypeExprParser.parse("Dict[\n    str,\n    int\n]"));
    }

    @Test
    void rejectsUnsupportedShapes() {
        for (String bad : List.of(
                "",
                "   ",
                "f(x)",
                "Callable[[int], str]",
                "(int, str)",
                "List[]",
                "a + b",
                "-1",
                "a\nb",
                "a; b",
                "X[int].attr",
                "'s'.upper",
                "'unterminated",
                "List[int",
                "int]",
                "a..b",
                "1abc",
                "<class 'int'>",
                "{{{not valid")) {
            assertThrows(TypeExprParseException.class, () -> TypeExprParser.parse(bad), () -> "should reject: " + bad);
        }
    }

    @Test
    void rejectsExcessiveNesting() {
        String deep = "L[".repeat(TypeExprParser.MAX_DEPTH + 5) + "int" + "]".repeat(TypeExprParser.MAX_DEPTH + 5);
        TypeExprParseException ex = assertThrows(TypeExprParseException.class, () -> TypeExprParser.parse(deep));
        assertTrue(ex.getMessage().contains("nested too deeply"));
    }

    @Test
    void reportsFailurePosition() {
        TypeExprParseException ex = assertThrows(TypeExprParseException.class, () -> TypeExprParser.parse("List[int} "));
        assertEquals(8, ex.position());
    }
}
