package info.isaksson.erland.funcanalyzer.docstring;

/**
 * One documented parameter as found by a structured parser.
 *
 * @param name        parameter name as written (without leading {@code *})
 * @param typeName    declared type text, or null when the docstring gives none
 * @param description description text, possibly multi-line, possibly empty
 */
public record DocstringParam(String name, String typeName, String description) {
    public DocstringParam {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        description = description == null ? "" : description.strip();
    }
}
