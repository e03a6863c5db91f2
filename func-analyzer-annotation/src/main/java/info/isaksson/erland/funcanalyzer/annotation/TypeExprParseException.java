package info.isaksson.erland.funcanalyzer.annotation;

/**
 * Signals that a string is not a supported type expression.
 *
 * <p>Internal: {@link AnnotationNormalizer} absorbs it and falls back to pattern cleaning.</p>
 */
public class TypeExprParseException extends Exception {

    private final int position;

    public TypeExprParseException(String message, int position) {
        super(message + " (at " + position + ")");
        this.position = position;
    }

    /** Character offset in the input where parsing stopped. */
    public int position() {
        return position;
    }
}
