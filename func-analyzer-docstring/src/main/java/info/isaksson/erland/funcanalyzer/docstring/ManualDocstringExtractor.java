package info.isaksson.erland.funcanalyzer.docstring;

import info.isaksson.erland.funcanalyzer.ir.ParamDocs;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based parameter recovery for docstrings the structured parsers cannot read.
 *
 * <p>Passes run in a fixed order over the same text and only fill names that are still
 * missing, so the first description found for a name is kept:</p>
 * <ol>
 *   <li>{@code :param name: description} fields;</li>
 *   <li>the same field pattern for the sphinx convention;</li>
 *   <li>a NumPy {@code Parameters} section.</li>
 * </ol>
 *
 * <p>Never throws; text that matches nothing yields an empty mapping.</p>
 */
public final class ManualDocstringExtractor {

    /** Description runs to the next {@code :field} line, a blank line, or the end of the text. */
    static final Pattern PARAM_FIELD = Pattern.compile(":param\\s+(\\w+):[ \\t]*(.*?)(?=\\n\\s*:|\\n\\s*\\n|$)", Pattern.DOTALL);

    private static final Pattern NUMPY_UNDERLINE = Pattern.compile("^\\s*-+\\s*$");
    private static final Pattern NUMPY_ENTRY = Pattern.compile("^(\\w+)\\s*:.*$");

    private ManualDocstringExtractor() {}

    public static ParamDocs extract(String docstring) {
        if (docstring == null || docstring.isBlank()) return ParamDocs.empty();
        ParamDocs.Builder out = ParamDocs.builder();
        fieldPass(docstring, out);  // google-style :param lines
        fieldPass(docstring, out);  // sphinx convention, same field syntax
        numpyPass(docstring, out);
        return out.build();
    }

    private static void fieldPass(String docstring, ParamDocs.Builder out) {
        Matcher m = PARAM_FIELD.matcher(docstring);
        while (m.find()) {
            out.putIfAbsent(m.group(1), DocstringText.joinDescription(DocstringText.splitLines(m.group(2))));
        }
    }

    private static void numpyPass(String docstring, ParamDocs.Builder out) {
        List<String> lines = DocstringText.splitLines(docstring);
        for (int i = 0; i + 1 < lines.size(); i++) {
            if (!lines.get(i).strip().equals("Parameters") || !NUMPY_UNDERLINE.matcher(lines.get(i + 1)).matches()) continue;

            int baseIndent = DocstringText.indentOf(lines.get(i));
            String name = null;
            List<String> desc = new ArrayList<>();
            for (int j = i + 2; j < lines.size(); j++) {
                String line = lines.get(j);
                if (line.isBlank()) break;
                if (DocstringText.indentOf(line) <= baseIndent) {
                    Matcher entry = NUMPY_ENTRY.matcher(line.strip());
                    if (!entry.matches()) break;
                    if (name != null) out.putIfAbsent(name, DocstringText.joinDescription(desc));
                    name = entry.group(1);
                    desc = new ArrayList<>();
                } else if (name != null) {
                    desc.add(line);
                }
            }
            if (name != null) out.putIfAbsent(name, DocstringText.joinDescription(desc));
            return;
        }
    }
}
