package info.isaksson.erland.funcanalyzer.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DocstringStyleTest {

    @Test
    void parsesCliValuesCaseInsensitively() {
        assertEquals(DocstringStyle.GOOGLE, DocstringStyle.parseCli("google"));
        assertEquals(DocstringStyle.NUMPY, DocstringStyle.parseCli(" NumPy "));
        assertEquals(DocstringStyle.SPHINX, DocstringStyle.parseCli("SPHINX"));
        assertEquals(DocstringStyle.AUTO, DocstringStyle.parseCli(null));
    }

    @Test
    void rejectsUnknownStyle() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> DocstringStyle.parseCli("epydoc"));
        assertTrue(ex.getMessage().contains("--style"));
    }
}
