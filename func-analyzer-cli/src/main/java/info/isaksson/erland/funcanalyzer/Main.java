package info.isaksson.erland.funcanalyzer;

import info.isaksson.erland.funcanalyzer.core.FuncAnalyzerJson;
import info.isaksson.erland.funcanalyzer.core.FuncAnalyzerOptions;
import info.isaksson.erland.funcanalyzer.core.FuncAnalyzerService;
import info.isaksson.erland.funcanalyzer.core.ParameterInput;
import info.isaksson.erland.funcanalyzer.core.ParameterSummary;
import info.isaksson.erland.funcanalyzer.ir.DocstringStyle;
import info.isaksson.erland.funcanalyzer.ir.ParamDocs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI entrypoint: annotation normalization and docstring parameter extraction.
 *
 * <p>Commands: {@code normalize}, {@code params}, {@code describe}. See {@link CliArgs#printHelp()}.</p>
 */
public final class Main {

    private static final FuncAnalyzerService SERVICE = new FuncAnalyzerService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        FuncAnalyzerOptions opts = toCoreOptions(parsed);

        if (parsed.command.equals("normalize")) {
            for (String expr : parsed.inputs) {
                System.out.println(SERVICE.normalizeAnnotation(expr, opts));
            }
            return 0;
        }

        final String docstring;
        try {
            docstring = readDocstring(parsed);
        } catch (IOException e) {
            System.err.println("Error: could not read docstring file: " + parsed.file);
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            if (parsed.command.equals("params")) {
                ParamDocs docs = SERVICE.extractParams(docstring, opts);
                if (parsed.json) {
                    System.out.print(FuncAnalyzerJson.toJsonString(docs));
                } else {
                    for (Map.Entry<String, String> e : docs.asMap().entrySet()) {
                        System.out.println(e.getKey() + ": " + e.getValue().replace("\n", "\n  "));
                    }
                }
            } else {
                List<ParameterSummary> summaries = SERVICE.describeParameters(parsed.params, docstring, opts);
                System.out.print(FuncAnalyzerJson.toJsonString(summaries));
            }
        } catch (IOException e) {
            System.err.println("Error: could not write JSON output.");
            System.err.println(e.getMessage());
            return 2;
        }
        return 0;
    }

    private static FuncAnalyzerOptions toCoreOptions(CliArgs parsed) {
        FuncAnalyzerOptions opts = new FuncAnalyzerOptions();
        opts.color = parsed.color;
        opts.docstringStyle = parsed.style;
        opts.structuredDocstrings = !parsed.manualOnly;
        return opts;
    }

    private static String readDocstring(CliArgs parsed) throws IOException {
        if (parsed.file == null) return parsed.inputs.get(0);
        Path path = Paths.get(parsed.file).toAbsolutePath().normalize();
        return Files.readString(path);
    }

    static final class CliArgs {
        boolean help = false;
        String command;

        String color;
        DocstringStyle style = DocstringStyle.AUTO;
        boolean manualOnly = false;
        boolean json = false;
        String file;

        final List<String> inputs = new ArrayList<>();
        final List<ParameterInput> params = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                if (out.command == null && !a.startsWith("-")) {
                    out.command = parseCommand(a);
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--color":
                        out.color = requireValue(args, ++i, "--color");
                        break;
                    case "--style":
                        out.style = DocstringStyle.parseCli(requireValue(args, ++i, "--style"));
                        break;
                    case "--manual-only":
                        out.manualOnly = true;
                        break;
                    case "--json":
                        out.json = true;
                        break;
                    case "--file":
                        out.file = requireValue(args, ++i, "--file");
                        break;
                    case "--param":
                        out.params.add(parseParam(requireValue(args, ++i, "--param")));
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        out.inputs.add(a);
                }
            }

            if (out.help) return out;
            out.validate();
            return out;
        }

        private void validate() {
            if (command == null) throw new IllegalArgumentException("A command is required.");
            switch (command) {
                case "normalize":
                    if (inputs.isEmpty()) throw new IllegalArgumentException("normalize needs at least one expression");
                    rejectFlag(file != null, "--file");
                    rejectFlag(!params.isEmpty(), "--param");
                    break;
                case "params":
                    requireSingleDocstring();
                    rejectFlag(!params.isEmpty(), "--param");
                    break;
                default:
                    requireSingleDocstring();
                    if (params.isEmpty()) throw new IllegalArgumentException("describe needs at least one --param");
                    rejectFlag(json, "--json");
            }
        }

        private void requireSingleDocstring() {
            if (file != null && !inputs.isEmpty()) {
                throw new IllegalArgumentException("Use either --file or a docstring argument, not both");
            }
            if (file == null && inputs.isEmpty()) {
                throw new IllegalArgumentException(command + " needs --file <path> or a docstring argument");
            }
            if (inputs.size() > 1) {
                throw new IllegalArgumentException("Unexpected extra argument: " + inputs.get(1));
            }
        }

        private void rejectFlag(boolean present, String flag) {
            if (present) throw new IllegalArgumentException(flag + " is not supported by " + command);
        }

        static String parseCommand(String v) {
            switch (v) {
                case "normalize":
                case "params":
                case "describe":
                    return v;
                default:
                    throw new IllegalArgumentException("Unknown command: " + v);
            }
        }

        /** {@code name=annotation[=default]}; an empty annotation means none. */
        static ParameterInput parseParam(String v) {
            String[] parts = v.split("=", 3);
            String name = parts[0].trim();
            if (name.isEmpty()) throw new IllegalArgumentException("Invalid value for --param: " + v);
            String annotation = parts.length > 1 && !parts[1].isBlank() ? parts[1] : null;
            if (parts.length > 2) return ParameterInput.withDefault(name, annotation, parts[2]);
            return ParameterInput.of(name, annotation);
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static void printHelp() {
            System.out.println(
                    "func-analyzer\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar func-analyzer.jar normalize [--color <name>] <expr>...\n" +
                    "  java -jar func-analyzer.jar params [options] (--file <path> | <docstring>)\n" +
                    "  java -jar func-analyzer.jar describe --param <p>... [options] (--file <path> | <docstring>)\n" +
                    "\n" +
                    "Options:\n" +
                    "  --color <name>         Wrap normalized annotations as <fg=name>(...)</>\n" +
                    "  --style <style>        Docstring style: google | numpy | sphinx | auto (default: auto)\n" +
                    "  --manual-only          Skip the structured docstring parsers, use regex patterns only\n" +
                    "  --json                 params: print JSON instead of 'name: description' lines\n" +
                    "  --file <path>          Read the docstring from a file\n" +
                    "  --param <p>            describe: name=annotation[=default] (repeatable, in order)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/func-analyzer.jar normalize \"typing.Union[str, int]\" \"<class 'int'>\"\n" +
                    "  java -jar target/func-analyzer.jar params --style numpy --file doc.txt --json\n" +
                    "  java -jar target/func-analyzer.jar describe --param \"name=str\" --param \"retries=int=3\" --file doc.txt\n"
            );
        }
    }
}
