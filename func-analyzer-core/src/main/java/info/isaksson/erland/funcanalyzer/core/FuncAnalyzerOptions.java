package info.isaksson.erland.funcanalyzer.core;

import info.isaksson.erland.funcanalyzer.ir.DocstringStyle;

/**
 * Core (server-friendly) options for annotation and docstring analysis.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class FuncAnalyzerOptions {
    /** Color tag used to decorate normalized annotations; null or blank means plain text. */
    public String color = null;

    public DocstringStyle docstringStyle = DocstringStyle.AUTO;

    /**
     * Whether the structured docstring parsers are available.
     *
     * <p>When false only the manual regex patterns are used (CLI flag {@code --manual-only}).</p>
     */
    public boolean structuredDocstrings = true;
}
