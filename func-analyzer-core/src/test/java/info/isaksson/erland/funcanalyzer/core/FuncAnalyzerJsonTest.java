package info.isaksson.erland.funcanalyzer.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.funcanalyzer.ir.ParamDocs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FuncAnalyzerJsonTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void paramDocsKeepDocstringOrder() throws Exception {
        ParamDocs.Builder b = ParamDocs.builder();
        b.putIfAbsent("zeta", "last");
        b.putIfAbsent("alpha", "two\nlines");

        String json = FuncAnalyzerJson.toJsonString(b.build());

        assertTrue(json.endsWith("}\n"));
        assertTrue(json.indexOf("\"zeta\"") < json.indexOf("\"alpha\""), json);
        assertTrue(json.contains("\n  \"zeta\""), json);
        JsonNode node = reader.readTree(json);
        assertEquals("two\nlines", node.get("alpha").asText());
        assertEquals(2, node.size());
    }

    @Test
    void emptyParamDocsIsAnEmptyObject() throws Exception {
        assertEquals(0, reader.readTree(FuncAnalyzerJson.toJsonString(ParamDocs.empty())).size());
    }

    @Test
    void summariesKeepOrderAndOmitMissingDefault() throws Exception {
        String json = FuncAnalyzerJson.toJsonString(List.of(
                new ParameterSummary("b", "int", "Bee.", false, "1"),
                new ParameterSummary("a", "str", "", true, null)));

        assertTrue(json.endsWith("]\n"));
        JsonNode arr = reader.readTree(json);
        assertEquals("b", arr.get(0).get("name").asText());
        assertEquals("1", arr.get(0).get("defaultValue").asText());
        assertFalse(arr.get(0).get("required").asBoolean());
        assertEquals("a", arr.get(1).get("name").asText());
        assertFalse(arr.get(1).has("defaultValue"));

        String first = json.substring(0, json.indexOf('}'));
        assertTrue(first.indexOf("\"defaultValue\"") < first.indexOf("\"description\""));
        assertTrue(first.indexOf("\"name\"") < first.indexOf("\"type\""));
    }

    @Test
    void outputIsStable() throws Exception {
        List<ParameterSummary> s = List.of(new ParameterSummary("x", "int", "d", true, null));
        assertEquals(FuncAnalyzerJson.toJsonString(s), FuncAnalyzerJson.toJsonString(s));
    }
}
