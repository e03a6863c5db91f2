package info.isaksson.erland.funcanalyzer.ir;

/**
 * Docstring convention hint.
 *
 * <p>{@link #AUTO} is not a parsing strategy of its own: it lets the structured parser try every
 * convention and keep the best result.</p>
 */
public enum DocstringStyle {
    /** {@code Args:} sections with indented {@code name (type): description} entries. */
    GOOGLE("google"),
    /** {@code Parameters} heading underlined with dashes, {@code name : type} entries. */
    NUMPY("numpy"),
    /** reStructuredText fields such as {@code :param name: description}. */
    SPHINX("sphinx"),
    /** Try all conventions (default). */
    AUTO("auto");

    public final String cliValue;

    DocstringStyle(String cliValue) {
        this.cliValue = cliValue;
    }

    public static DocstringStyle parseCli(String v) {
        if (v == null) return AUTO;
        String s = v.trim().toLowerCase();
        for (DocstringStyle style : values()) {
            if (style.cliValue.equals(s)) return style;
        }
        throw new IllegalArgumentException("Invalid value for --style: " + v + " (expected one of: google|numpy|sphinx|auto)");
    }
}
