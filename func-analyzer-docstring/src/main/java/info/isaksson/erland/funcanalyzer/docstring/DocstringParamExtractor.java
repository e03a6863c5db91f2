package info.isaksson.erland.funcanalyzer.docstring;

import info.isaksson.erland.funcanalyzer.ir.DocstringStyle;
import info.isaksson.erland.funcanalyzer.ir.ParamDocs;
import info.isaksson.erland.funcanalyzer.support.WithFallback;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Extracts parameter descriptions from a docstring.
 *
 * <p>The structured parser for the requested style runs first; if it throws, or if this
 * extractor was built without structured parsers, {@link ManualDocstringExtractor} is used.
 * Only parameters with a non-blank description are returned; the first description of a
 * name wins.</p>
 */
public final class DocstringParamExtractor {

    private final Map<DocstringStyle, Function<String, ParamDocs>> pipelines;

    /** Uses the built-in google/numpy/sphinx/auto parsers. */
    public DocstringParamExtractor() {
        this(StructuredDocstringParser::forStyle);
    }

    /**
     * @param parsers structured parser per style; a null parser for a style means none is
     *                available and the manual extractor is used directly
     */
    public DocstringParamExtractor(Function<DocstringStyle, StructuredDocstringParser> parsers) {
        Map<DocstringStyle, Function<String, ParamDocs>> m = new EnumMap<>(DocstringStyle.class);
        for (DocstringStyle style : DocstringStyle.values()) {
            StructuredDocstringParser parser = parsers == null ? null : parsers.apply(style);
            Function<String, ParamDocs> pipeline;
            if (parser == null) {
                pipeline = ManualDocstringExtractor::extract;
            } else {
                pipeline = WithFallback.<String, ParamDocs>of(
                        "docstring:" + style.cliValue,
                        d -> toParamDocs(parser.parse(d)),
                        ManualDocstringExtractor::extract);
            }
            m.put(style, pipeline);
        }
        this.pipelines = m;
    }

    /** An extractor that only uses the manual patterns. */
    public static DocstringParamExtractor manualOnly() {
        return new DocstringParamExtractor(null);
    }

    public ParamDocs extractParams(String docstring) {
        return extractParams(docstring, DocstringStyle.AUTO);
    }

    public ParamDocs extractParams(String docstring, DocstringStyle style) {
        if (docstring == null || docstring.isBlank()) return ParamDocs.empty();
        return pipelines.get(style == null ? DocstringStyle.AUTO : style).apply(docstring);
    }

    private static ParamDocs toParamDocs(List<DocstringParam> params) {
        ParamDocs.Builder b = ParamDocs.builder();
        for (DocstringParam p : params) {
            b.putIfAbsent(p.name(), p.description());
        }
        return b.build();
    }
}
