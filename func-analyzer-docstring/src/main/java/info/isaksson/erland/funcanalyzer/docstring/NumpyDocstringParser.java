package info.isaksson.erland.funcanalyzer.docstring;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * NumPy style:
 * <pre>
 * Parameters
 * ----------
 * x, y : float
 *     Coordinates.
 * label : str, optional
 *     Text shown next to the point.
 * </pre>
 *
 * <p>Lenient: entries it cannot read are skipped, it never throws.</p>
 */
public final class NumpyDocstringParser implements StructuredDocstringParser {

    static final NumpyDocstringParser INSTANCE = new NumpyDocstringParser();

    private static final Set<String> PARAM_SECTIONS = Set.of("Parameters", "Other Parameters");
    private static final Pattern UNDERLINE = Pattern.compile("^\\s*-+\\s*$");
    private static final Pattern NAME = Pattern.compile("^\\*{0,2}(\\w+)$");

    @Override
    public List<DocstringParam> parse(String docstring) {
        List<String> lines = DocstringText.cleanLines(docstring);
        List<DocstringParam> out = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            if (!isSectionStart(lines, i)) {
                i++;
                continue;
            }
            String title = lines.get(i).strip();
            int end = i + 2;
            while (end < lines.size() && !isSectionStart(lines, end)) end++;
            if (PARAM_SECTIONS.contains(title)) {
                parseEntries(lines.subList(i + 2, end), DocstringText.indentOf(lines.get(i)), out);
            }
            i = end;
        }
        return out;
    }

    private static boolean isSectionStart(List<String> lines, int i) {
        return i + 1 < lines.size()
                && !lines.get(i).isBlank()
                && UNDERLINE.matcher(lines.get(i + 1)).matches();
    }

    private static void parseEntries(List<String> body, int sectionIndent, List<DocstringParam> out) {
        String key = null;
        List<String> desc = new ArrayList<>();
        for (String line : body) {
            if (!line.isBlank() && DocstringText.indentOf(line) <= sectionIndent) {
                if (key != null) addEntries(key, desc, out);
                key = line.strip();
                desc = new ArrayList<>();
            } else if (key != null) {
                desc.add(line);
            }
        }
        if (key != null) addEntries(key, desc, out);
    }

    private static void addEntries(String key, List<String> desc, List<DocstringParam> out) {
        String names = key;
        String type = null;
        int colon = key.indexOf(':');
        if (colon >= 0) {
            names = key.substring(0, colon);
            type = key.substring(colon + 1).strip();
            if (type.isEmpty()) type = null;
        }
        String description = DocstringText.joinDescription(desc);
        for (String raw : names.split(",")) {
            var m = NAME.matcher(raw.strip());
            if (m.matches()) out.add(new DocstringParam(m.group(1), type, description));
        }
    }
}
