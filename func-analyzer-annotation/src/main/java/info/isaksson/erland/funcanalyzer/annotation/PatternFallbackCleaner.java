package info.isaksson.erland.funcanalyzer.annotation;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort, regex-based annotation cleanup for strings the parser rejects, such as runtime
 * reprs like {@code <class 'int'>}.
 *
 * <p>Rules run in a fixed order; each one sees the output of the previous one:</p>
 * <ol>
 *   <li>strip {@code typing.}</li>
 *   <li>strip {@code __main__.}</li>
 *   <li>strip {@code builtins.}</li>
 *   <li>strip {@code collections.abc.}</li>
 *   <li>{@code pkg.module.ClassName} becomes {@code ClassName}; inside {@code <class '...'>} the
 *       chain is only shortened to {@code pkg.ClassName}</li>
 *   <li>{@code <class 'word'>} becomes {@code word}</li>
 *   <li>{@code <class 'word.word'>} becomes {@code word.word}; the dot is kept</li>
 * </ol>
 *
 * <p>Never throws. Input that matches no rule is returned unchanged.</p>
 */
public final class PatternFallbackCleaner {

    private static final Pattern REPR_WRAPPER = Pattern.compile("<class '[^']*'>");
    private static final Pattern QUALIFIED_CLASS = Pattern.compile("(?:[a-zA-Z_][a-zA-Z0-9_]*\\.)+([A-Z][a-zA-Z0-9_]*)");
    private static final Pattern WRAPPED_CHAIN = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\.(?:[a-zA-Z_][a-zA-Z0-9_]*\\.)+([A-Z][a-zA-Z0-9_]*)");

    private static final List<Rule> RULES = List.of(
            strip("typing", "\\btyping\\."),
            strip("main-module", "\\b__main__\\."),
            strip("builtins", "\\bbuiltins\\."),
            strip("collections-abc", "\\bcollections\\.abc\\."),
            new Rule("module-class", PatternFallbackCleaner::collapseQualifiedClasses),
            replace("class-repr", "<class '(\\w+)'>", "$1"),
            replace("dotted-class-repr", "<class '(\\w+\\.\\w+)'>", "$1")
    );

    private PatternFallbackCleaner() {}

    public static String clean(String annotation) {
        if (annotation == null) return "";
        String cleaned = annotation;
        for (Rule rule : RULES) {
            cleaned = rule.apply(cleaned);
        }
        return cleaned;
    }

    /** Rule names in application order. */
    static List<String> ruleNames() {
        return RULES.stream().map(Rule::name).toList();
    }

    private static String collapseQualifiedClasses(String s) {
        Matcher wrappers = REPR_WRAPPER.matcher(s);
        StringBuilder out = new StringBuilder(s.length());
        int last = 0;
        while (wrappers.find()) {
            out.append(QUALIFIED_CLASS.matcher(s.substring(last, wrappers.start())).replaceAll("$1"));
            out.append(WRAPPED_CHAIN.matcher(wrappers.group()).replaceAll("$1.$2"));
            last = wrappers.end();
        }
        out.append(QUALIFIED_CLASS.matcher(s.substring(last)).replaceAll("$1"));
        return out.toString();
    }

    private static Rule strip(String name, String regex) {
        return replace(name, regex, "");
    }

    private static Rule replace(String name, String regex, String replacement) {
        Pattern p = Pattern.compile(regex);
        return new Rule(name, s -> p.matcher(s).replaceAll(replacement));
    }

    private record Rule(String name, UnaryOperator<String> op) {
        String apply(String s) {
            return op.apply(s);
        }
    }
}
