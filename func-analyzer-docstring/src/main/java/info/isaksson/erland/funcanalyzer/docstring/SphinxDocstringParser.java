package info.isaksson.erland.funcanalyzer.docstring;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * reStructuredText field lists:
 * <pre>
 * :param name: The user name.
 * :param int age: Age in years.
 * :type name: str
 * :returns: A greeting.
 * </pre>
 *
 * <p>A field starts at a line beginning with {@code :} and runs until the next one; its name
 * must be closed by a second {@code :} on the same line. Fields other than parameters are read
 * but ignored.</p>
 */
public final class SphinxDocstringParser implements StructuredDocstringParser {

    static final SphinxDocstringParser INSTANCE = new SphinxDocstringParser();

    private static final Set<String> PARAM_KEYWORDS = Set.of("param", "parameter", "arg", "argument", "key", "keyword");

    @Override
    public List<DocstringParam> parse(String docstring) throws DocstringParseException {
        List<DocstringParam> out = new ArrayList<>();
        for (String field : fields(DocstringText.cleanLines(docstring))) {
            DocstringParam p = parseField(field);
            if (p != null) out.add(p);
        }
        return out;
    }

    private static List<String> fields(List<String> lines) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = null;
        for (String line : lines) {
            if (line.startsWith(":")) {
                if (current != null) fields.add(current.toString());
                current = new StringBuilder(line);
            } else if (current != null) {
                current.append('\n').append(line);
            }
        }
        if (current != null) fields.add(current.toString());
        return fields;
    }

    private static DocstringParam parseField(String field) throws DocstringParseException {
        String body = field.substring(1);
        int colon = firstLine(body).indexOf(':');
        if (colon < 0) {
            throw new DocstringParseException("Error parsing field near '" + firstLine(field) + "'");
        }
        String[] args = body.substring(0, colon).trim().split("\\s+");
        if (!PARAM_KEYWORDS.contains(args[0])) return null;

        String type;
        String name;
        if (args.length == 2) {
            type = null;
            name = args[1];
        } else if (args.length == 3) {
            type = args[1];
            name = args[2];
        } else {
            throw new DocstringParseException("Expected one or two arguments for a " + args[0] + " keyword in '" + firstLine(field) + "'");
        }
        String description = DocstringText.joinDescription(DocstringText.splitLines(body.substring(colon + 1)));
        return new DocstringParam(name.replaceFirst("^\\*{1,2}", ""), type, description);
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
