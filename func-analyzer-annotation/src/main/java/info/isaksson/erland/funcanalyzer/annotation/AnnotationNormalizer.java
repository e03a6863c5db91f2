package info.isaksson.erland.funcanalyzer.annotation;

import info.isaksson.erland.funcanalyzer.support.WithFallback;

/**
 * Entry point for turning a raw annotation string into its canonical form.
 *
 * <p>The string is parsed and re-rendered without qualifiers; if it is not a supported
 * expression, {@link PatternFallbackCleaner} is used instead. Every input yields a result.</p>
 */
public final class AnnotationNormalizer {

    private static final WithFallback<String, String> PIPELINE = WithFallback.of(
            "annotation",
            raw -> CanonicalRenderer.render(TypeExprParser.parse(raw)),
            PatternFallbackCleaner::clean
    );

    private AnnotationNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        return PIPELINE.apply(raw);
    }

    /** Normalizes and, when {@code color} is non-blank, decorates the result. */
    public static String normalize(String raw, String color) {
        return AnnotationDecorator.decorate(normalize(raw), color);
    }

    /** Stringifies {@code value} (see {@link TypeStringifier}) and normalizes it. */
    public static String normalizeValue(Object value) {
        return normalize(TypeStringifier.stringify(value));
    }

    public static String normalizeValue(Object value, String color) {
        return normalize(TypeStringifier.stringify(value), color);
    }
}
