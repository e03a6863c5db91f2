package info.isaksson.erland.funcanalyzer.core;

import info.isaksson.erland.funcanalyzer.annotation.AnnotationNormalizer;
import info.isaksson.erland.funcanalyzer.docstring.DocstringParamExtractor;
import info.isaksson.erland.funcanalyzer.ir.ParamDocs;

import java.util.ArrayList;
import java.util.List;

/**
 * Core (server-friendly) API for annotation normalization and docstring parameter extraction.
 *
 * <p>CLI and server wrappers should use this class instead of wiring the pipelines themselves.
 * Instances are stateless and safe to share.</p>
 */
public final class FuncAnalyzerService {

    private final DocstringParamExtractor structured = new DocstringParamExtractor();
    private final DocstringParamExtractor manual = DocstringParamExtractor.manualOnly();

    /** Canonical (optionally decorated) form of an annotation. Never throws for content. */
    public String normalizeAnnotation(Object annotation, FuncAnalyzerOptions options) {
        if (options == null) options = new FuncAnalyzerOptions();
        return AnnotationNormalizer.normalizeValue(annotation, options.color);
    }

    /** Parameter name to description mapping; empty for a null or blank docstring. */
    public ParamDocs extractParams(String docstring, FuncAnalyzerOptions options) {
        if (options == null) options = new FuncAnalyzerOptions();
        DocstringParamExtractor extractor = options.structuredDocstrings ? structured : manual;
        return extractor.extractParams(docstring, options.docstringStyle);
    }

    /**
     * Pairs each parameter's canonical type with its docstring description.
     *
     * <p>The result follows the order of {@code parameters}. Parameters the docstring does not
     * describe get an empty description.</p>
     */
    public List<ParameterSummary> describeParameters(List<ParameterInput> parameters, String docstring, FuncAnalyzerOptions options) {
        if (parameters == null) throw new IllegalArgumentException("parameters must not be null");
        if (options == null) options = new FuncAnalyzerOptions();

        ParamDocs docs = extractParams(docstring, options);
        List<ParameterSummary> out = new ArrayList<>(parameters.size());
        for (ParameterInput p : parameters) {
            out.add(new ParameterSummary(
                    p.name(),
                    normalizeAnnotation(p.annotation(), options),
                    docs.description(p.name()).orElse(""),
                    p.required(),
                    p.defaultValue()
            ));
        }
        return out;
    }
}
