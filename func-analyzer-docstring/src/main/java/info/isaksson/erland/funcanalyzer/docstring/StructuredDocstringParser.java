package info.isaksson.erland.funcanalyzer.docstring;

import info.isaksson.erland.funcanalyzer.ir.DocstringStyle;

import java.util.List;

/**
 * Convention-aware docstring parser.
 *
 * <p>Implementations are stateless. They return every documented parameter in order of
 * appearance, including ones without a description, and throw
 * {@link DocstringParseException} when the text breaks their convention.</p>
 */
public interface StructuredDocstringParser {

    List<DocstringParam> parse(String docstring) throws DocstringParseException;

    /** The parser assumed by a style tag; {@link DocstringStyle#AUTO} tries all of them. */
    static StructuredDocstringParser forStyle(DocstringStyle style) {
        if (style == null) return AutoDocstringParser.INSTANCE;
        return switch (style) {
            case GOOGLE -> GoogleDocstringParser.INSTANCE;
            case NUMPY -> NumpyDocstringParser.INSTANCE;
            case SPHINX -> SphinxDocstringParser.INSTANCE;
            case AUTO -> AutoDocstringParser.INSTANCE;
        };
    }
}
