package info.isaksson.erland.funcanalyzer.docstring;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Google style:
 * <pre>
 * Args:
 *     name (str): The user name.
 *     age: Age in years,
 *         continued on an indented line.
 * </pre>
 */
public final class GoogleDocstringParser implements StructuredDocstringParser {

    static final GoogleDocstringParser INSTANCE = new GoogleDocstringParser();

    private static final Set<String> PARAM_SECTIONS = Set.of(
            "args", "arguments", "parameters", "params",
            "keyword args", "keyword arguments", "other parameters");

    private static final Pattern SECTION_TITLE = Pattern.compile("^([A-Za-z][A-Za-z ]*):\\s*$");
    private static final Pattern ENTRY_HEAD = Pattern.compile("^\\*{0,2}(\\w+)\\s*(?:\\((.*)\\))?$");

    @Override
    public List<DocstringParam> parse(String docstring) throws DocstringParseException {
        List<String> lines = DocstringText.cleanLines(docstring);
        List<DocstringParam> out = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            Matcher title = SECTION_TITLE.matcher(lines.get(i));
            if (!title.matches()) {
                i++;
                continue;
            }
            int end = i + 1;
            while (end < lines.size() && (lines.get(end).isBlank() || DocstringText.indentOf(lines.get(end)) > 0)) end++;
            if (PARAM_SECTIONS.contains(title.group(1).trim().toLowerCase())) {
                parseEntries(lines.subList(i + 1, end), out);
            }
            i = end;
        }
        return out;
    }

    private static void parseEntries(List<String> body, List<DocstringParam> out) throws DocstringParseException {
        int itemIndent = -1;
        String head = null;
        List<String> desc = new ArrayList<>();
        for (String line : body) {
            if (line.isBlank()) {
                if (head != null) desc.add("");
                continue;
            }
            int indent = DocstringText.indentOf(line);
            if (itemIndent < 0) itemIndent = indent;
            if (indent <= itemIndent) {
                if (head != null) out.add(entry(head, desc));
                String text = line.strip();
                int colon = topLevelColon(text);
                if (colon < 0) throw new DocstringParseException("Expected a colon in '" + text + "'");
                head = text.substring(0, colon).trim();
                desc = new ArrayList<>();
                desc.add(text.substring(colon + 1));
            } else {
                desc.add(line);
            }
        }
        if (head != null) out.add(entry(head, desc));
    }

    private static DocstringParam entry(String head, List<String> desc) throws DocstringParseException {
        Matcher m = ENTRY_HEAD.matcher(head);
        if (!m.matches()) throw new DocstringParseException("Cannot parse parameter name in '" + head + "'");
        String type = m.group(2) == null ? null : m.group(2).trim();
        return new DocstringParam(m.group(1), type, DocstringText.joinDescription(desc));
    }

    /** Index of the first ':' outside of parentheses/brackets, or -1. */
    private static int topLevelColon(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') depth++;
            else if ((c == ')' || c == ']') && depth > 0) depth--;
            else if (c == ':' && depth == 0) return i;
        }
        return -1;
    }
}
