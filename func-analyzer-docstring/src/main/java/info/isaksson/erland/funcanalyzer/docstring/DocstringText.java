package info.isaksson.erland.funcanalyzer.docstring;

import java.util.ArrayList;
import java.util.List;

/** Line handling shared by the docstring parsers. */
final class DocstringText {

    private static final String TAB = "        ";

    private DocstringText() {}

    /**
     * Dedents a raw docstring the way Python's {@code inspect.cleandoc} does: tabs expanded, the
     * first line left-stripped, the common indentation of the remaining lines removed, and
     * leading/trailing blank lines dropped.
     */
    static List<String> cleanLines(String doc) {
        List<String> lines = new ArrayList<>(splitLines(doc.replace("\t", TAB)));
        if (lines.isEmpty()) return lines;

        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            margin = Math.min(margin, indentOf(line));
        }
        lines.set(0, lines.get(0).stripLeading());
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            lines.set(i, line.isBlank() ? "" : line.substring(Math.min(margin, line.length())));
        }

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);
        while (!lines.isEmpty() && lines.get(0).isBlank()) lines.remove(0);
        return lines;
    }

    static List<String> splitLines(String text) {
        return List.of(text.split("\\r?\\n", -1));
    }

    static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return i;
    }

    /** Strips every line, drops leading/trailing blank ones and joins with {@code \n}. */
    static String joinDescription(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (String l : lines) out.add(l.strip());
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
        while (!out.isEmpty() && out.get(0).isEmpty()) out.remove(0);
        return String.join("\n", out);
    }
}
