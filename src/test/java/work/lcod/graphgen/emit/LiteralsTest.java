package work.lcod.graphgen.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LiteralsTest {
    @Test
    void javaStringEscapesQuotesAndControls() {
        assertEquals("\"say \\\"hi\\\"\\n\"", Literals.javaString("say \"hi\"\n"));
        assertEquals("\"bell\\007\"", Literals.javaString("bell\u0007"));
    }

    @Test
    void rustStringUsesBracedUnicodeEscapes() {
        assertEquals("\"bell\\u{7}\"", Literals.rustString("bell\u0007"));
        assertEquals("\"a\\\\b\"", Literals.rustString("a\\b"));
    }

    @Test
    void commentsStayOnOneLineAndCannotCloseBlocks() {
        assertEquals("first second", Literals.comment("  first\n\tsecond "));
        assertEquals("ends *\\/ here", Literals.comment("ends */ here"));
        assertEquals("path C:\\\\u0041", Literals.comment("path C:\\u0041"));
    }
}
