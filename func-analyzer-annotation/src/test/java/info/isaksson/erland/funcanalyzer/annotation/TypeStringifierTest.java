package info.isaksson.erland.funcanalyzer.annotation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TypeStringifierTest {

    @SuppressWarnings("unused")
    private static final class Sample<T> {
        Map<String, List<Integer>> nested;
        List<? extends Number> upper;
        List<? super Integer> lower;
        List<?> any;
        T[] generic;
        int[] primitives;
    }

    @Test
    void writesReflectionTypesInBracketSyntax() throws Exception {
        assertEquals("java.util.Map[java.lang.String, java.util.List[java.lang.Integer]]", field("nested"));
        assertEquals("java.util.List[? extends java.lang.Number]", field("upper"));
        assertEquals("java.util.List[? super java.lang.Integer]", field("lower"));
        assertEquals("java.util.List[?]", field("any"));
        assertEquals("T[]", field("generic"));
        assertEquals("int[]", field("primitives"));
    }

    @Test
    void nestedClassesUseDots() {
        assertEquals("java.util.Map.Entry", TypeStringifier.stringify(Map.Entry.class));
    }

    @Test
    void otherValuesUseStringValueOf() {
        assertEquals("", TypeStringifier.stringify(null));
        assertEquals("already text", TypeStringifier.stringify("already text"));
        assertEquals("42", TypeStringifier.stringify(42));
    }

    private static String field(String name) throws NoSuchFieldException {
        return TypeStringifier.stringify(Sample.class.getDeclaredField(name).getGenericType());
    }
}
