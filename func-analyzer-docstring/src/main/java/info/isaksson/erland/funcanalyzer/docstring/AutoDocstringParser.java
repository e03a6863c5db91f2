package info.isaksson.erland.funcanalyzer.docstring;

import java.util.List;

/**
 * Tries every convention and keeps the result that found the most parameters.
 *
 * <p>Order is sphinx, google, numpy; on a tie the earlier parser wins. If all of them fail,
 * the first failure is rethrown.</p>
 */
public final class AutoDocstringParser implements StructuredDocstringParser {

    static final AutoDocstringParser INSTANCE = new AutoDocstringParser(List.of(
            SphinxDocstringParser.INSTANCE,
            GoogleDocstringParser.INSTANCE,
            NumpyDocstringParser.INSTANCE
    ));

    private final List<StructuredDocstringParser> candidates;

    AutoDocstringParser(List<StructuredDocstringParser> candidates) {
        if (candidates == null || candidates.isEmpty()) throw new IllegalArgumentException("candidates must not be empty");
        this.candidates = List.copyOf(candidates);
    }

    @Override
    public List<DocstringParam> parse(String docstring) throws DocstringParseException {
        List<DocstringParam> best = null;
        DocstringParseException firstFailure = null;
        for (StructuredDocstringParser candidate : candidates) {
            try {
                List<DocstringParam> params = candidate.parse(docstring);
                if (best == null || params.size() > best.size()) best = params;
            } catch (DocstringParseException e) {
                if (firstFailure == null) firstFailure = e;
            }
        }
        if (best == null) throw firstFailure;
        return best;
    }
}
