package info.isaksson.erland.funcanalyzer.annotation;

/** Cosmetic color markup around an already-normalized annotation. */
public final class AnnotationDecorator {

    public static final String DEFAULT_COLOR = "cyan";

    private AnnotationDecorator() {}

    /** Wraps as {@code <fg=COLOR>(TEXT)</>}; a blank or null color leaves the text untouched. */
    public static String decorate(String annotation, String color) {
        if (color == null || color.isBlank()) return annotation;
        return "<fg=" + color.trim() + ">(" + annotation + ")</>";
    }
}
