package info.isaksson.erland.funcanalyzer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    private static final String DOC = """
            Sends a message.

            Parameters
            ----------
            recipient : str
                Who receives it.
            retries : int
                How often to retry.
            """;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void normalizePrintsOneLinePerExpression() {
        int code = Main.run(new String[] {"normalize", "typing.Union[str, int, float]", "<class 'int'>", "{{{not valid"});

        assertEquals(0, code, stderr());
        String[] lines = stdout().split("\n");
        assertEquals("str | int | float", lines[0]);
        assertEquals("int", lines[1]);
        assertEquals(3, lines.length);
    }

    @Test
    void normalizeWithColor() {
        assertEquals(0, Main.run(new String[] {"normalize", "--color", "cyan", "outer.inner.MyType"}));
        assertEquals("<fg=cyan>(MyType)</>\n", stdout());
    }

    @Test
    void paramsFromFileAsJson() throws Exception {
        Path doc = Files.createTempDirectory("fa-cli-").resolve("doc.txt");
        Files.writeString(doc, DOC);

        int code = Main.run(new String[] {"params", "--style", "numpy", "--json", "--file", doc.toString()});

        assertEquals(0, code, stderr());
        String json = stdout();
        assertTrue(json.contains("\"recipient\""), json);
        assertTrue(json.contains("Who receives it."), json);
        assertTrue(json.endsWith("}\n"));
    }

    @Test
    void paramsAsTextLines() {
        int code = Main.run(new String[] {"params", "--manual-only", ":param x: first\n:param x: second"});
        assertEquals(0, code, stderr());
        assertEquals("x: first\n", stdout());
    }

    @Test
    void jsonAndTextListParamsInTheSameOrder() {
        String doc = ":param beta: Second letter.\n:param alpha: First letter.";

        assertEquals(0, Main.run(new String[] {"params", doc}));
        assertEquals("beta: Second letter.\nalpha: First letter.\n", stdout());
        out.reset();

        assertEquals(0, Main.run(new String[] {"params", "--json", doc}));
        String json = stdout();
        assertTrue(json.indexOf("\"beta\"") < json.indexOf("\"alpha\""), json);
    }

    @Test
    void describeEmitsSummaries() {
        int code = Main.run(new String[] {
                "describe",
                "--param", "recipient=builtins.str",
                "--param", "retries=int=3",
                "--param", "flag",
                DOC
        });

        assertEquals(0, code, stderr());
        String json = stdout();
        assertTrue(json.startsWith("["), json);
        assertTrue(json.indexOf("recipient") < json.indexOf("retries"), json);
        assertTrue(json.contains("How often to retry."), json);
        assertTrue(json.contains("\"3\""), json);
    }

    @Test
    void usageErrorsExitWithOne() {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"params", "--style", "rst", "text"}));
        assertTrue(stderr().contains("Invalid value for --style: rst"), stderr());
        assertTrue(stdout().contains("Usage:"));
        assertEquals(1, Main.run(new String[] {"frobnicate"}));
        assertEquals(1, Main.run(new String[] {"describe", "text"}));
        assertEquals(1, Main.run(new String[] {"params", "--bogus", "text"}));
        assertEquals(1, Main.run(new String[] {"params", "a", "b"}));
    }

    @Test
    void missingFileExitsWithTwo() throws Exception {
        Path missing = Files.createTempDirectory("fa-cli-").resolve("nope.txt");
        assertEquals(2, Main.run(new String[] {"params", "--file", missing.toString()}));
        assertTrue(stderr().contains("could not read docstring file"));
    }

    @Test
    void helpExitsWithZero() {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertTrue(stdout().contains("normalize"));
    }
}
