package scaraplate.parsers;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineParserTest {

    private static final Pattern COMMENT = Pattern.compile("^ *#");

    @Test
    void headerEndsAtBlankLine() {
        LineDocument document = LineParser.parse("# License\n# Copyright\n\ninclude a\n", COMMENT);

        assertEquals(List.of("# License", "# Copyright"), document.getHeader());
        assertTrue(document.isSeparated());
        assertEquals(1, document.getItems().size());
        assertEquals("include a", document.getItems().get(0).getLine());
        assertTrue(document.getItems().get(0).getComments().isEmpty());
    }

    @Test
    void leadingCommentsFollowedByLineAreHeader() {
        LineDocument document = LineParser.parse("# License\ninclude a\n", COMMENT);

        assertEquals(List.of("# License"), document.getHeader());
        assertFalse(document.isSeparated());
        assertTrue(document.getItems().get(0).getComments().isEmpty());
    }

    @Test
    void headerStopsAtFirstBlankLine() {
        LineDocument document = LineParser.parse("# License\n\n# about a\ninclude a\n", COMMENT);

        assertEquals(List.of("# License"), document.getHeader());
        assertTrue(document.isSeparated());
        assertEquals(List.of("# about a"), document.getItems().get(0).getComments());
    }

    @Test
    void commentsAttachToNextLine() {
        LineDocument document = LineParser.parse("a\n# about b\n\n# more about b\nb\n# trailing\n", COMMENT);

        assertEquals(2, document.getItems().size());
        assertEquals(List.of("# about b", "# more about b"), document.getItems().get(1).getComments());
        assertEquals(List.of("# trailing"), document.getOrphans());
    }

    @Test
    void commentOnlyTextIsHeader() {
        LineDocument document = LineParser.parse("# one\n# two\n", COMMENT);

        assertEquals(List.of("# one", "# two"), document.getHeader());
        assertTrue(document.getItems().isEmpty());
        assertTrue(document.getOrphans().isEmpty());
    }

    @Test
    void blankLinesAreDropped() {
        LineDocument document = LineParser.parse("\n\na\n   \nb\n\n", COMMENT);

        assertEquals(2, document.getItems().size());
        assertFalse(document.hasHeader());
    }
}
