package info.isaksson.erland.funcanalyzer.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import info.isaksson.erland.funcanalyzer.ir.ParamDocs;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * JSON output for extracted parameter docs and parameter summaries.
 *
 * <p>Writing is deterministic: record properties are sorted, parameter docs keep their
 * docstring order, indentation is fixed and every document ends with a newline.</p>
 */
public final class FuncAnalyzerJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private FuncAnalyzerJson() {}

    /** {@code {"name": "description", ...}} in the order the names appear in the docstring. */
    public static String toJsonString(ParamDocs docs) throws IOException {
        if (docs == null) throw new IllegalArgumentException("docs is null");
        return MAPPER.writer(PRETTY)
                .without(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writeValueAsString(new LinkedHashMap<>(docs.asMap())) + "\n";
    }

    /** A JSON array of summaries, in parameter order. */
    public static String toJsonString(List<ParameterSummary> summaries) throws IOException {
        if (summaries == null) throw new IllegalArgumentException("summaries is null");
        return MAPPER.writer(PRETTY).writeValueAsString(summaries) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .build();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
