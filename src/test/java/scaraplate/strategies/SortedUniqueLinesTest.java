package scaraplate.strategies;

import org.junit.jupiter.api.Test;
import scaraplate.config.ConfigurationException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static scaraplate.strategies.SetupCfgMergeTest.apply;

class SortedUniqueLinesTest {

    private static final String TEMPLATE_WITH_HEADER = "# Licensed under blah blah\n"
            + "# A Copyright blah blah\n"
            + "\n"
            + "include b\n"
            + "# A T Copyright blah blah\n"
            + "graft a\n";

    private final Strategy strategy = SortedUniqueLines.create(RawConfig.empty("MANIFEST.in"));

    @Test
    void nonExistingTarget_sortsOrdinally() {
        String template = "zz с юникодом\nPy тон\npysomething\n# comment\ngraft\n";

        assertEquals("Py тон\n# comment\ngraft\npysomething\nzz с юникодом\n", apply(strategy, template, null));
    }

    @Test
    void existingTarget_unionOfLines() {
        assertEquals("graft a\ninclude b\ninclude c\n", apply(strategy, "include b\ngraft a\n", "include c\ngraft a\n"));
    }

    @Test
    void linesDifferingInCaseAreDistinct() {
        assertEquals("ENV/\nenv/\n", apply(strategy, "env/\n", "ENV/\n"));
        assertEquals("ENV/\nenv/\n", apply(strategy, "ENV/\n", "env/\n"));
    }

    @Test
    void emptyTemplate() {
        assertEquals("", apply(strategy, "", null));
    }

    @Test
    void licenseHeaderComesFromTemplate() {
        String template = "# Licensed under blah blah\n# A Copyright blah blah\n\ninclude b\ngraft a\n";
        String target = "# Licensed under blah blah\n# A Copyright 1970 blah blah\n\ninclude a\n";

        String expected = "# Licensed under blah blah\n# A Copyright blah blah\n\ngraft a\ninclude a\ninclude b\n";
        assertEquals(expected, apply(strategy, template, target));
    }

    @Test
    void headerFromTargetWhenTemplateHasNone() {
        String target = "# Project specific\n\ninclude a\n";

        assertEquals("# Project specific\n\ninclude a\ninclude b\n", apply(strategy, "include b\n", target));
    }

    @Test
    void commentsTravelWithTheirLines() {
        String target = "# Licensed under blah blah\n# A Copyright 1970 blah blah\n\ninclude a\n# A D Copyright blah blah\n";

        String expected = "# Licensed under blah blah\n"
                + "# A Copyright blah blah\n"
                + "\n"
                + "# A T Copyright blah blah\n"
                + "graft a\n"
                + "include a\n"
                + "include b\n"
                + "# A D Copyright blah blah\n";
        assertEquals(expected, apply(strategy, TEMPLATE_WITH_HEADER, target));
    }

    @Test
    void commentsOfTheSameLineAreUnioned() {
        String template = "a\n# from template\nfoo\n";
        String target = "a\n# from target\nfoo\n# from template\nbar\n";

        String expected = "a\n# from template\nbar\n# from template\n# from target\nfoo\n";
        assertEquals(expected, apply(strategy, template, target));
    }

    @Test
    void customCommentPattern() {
        Strategy rst = SortedUniqueLines.create(new RawConfig("MANIFEST.in", Map.of("comment_pattern", "^ *[.][.] ")));

        String actual = apply(rst, ".. rst comment\n\ninclude b\ngraft a\n", "\ninclude a\n");

        assertEquals(".. rst comment\n\ngraft a\ninclude a\ninclude b\n", actual);
    }

    @Test
    void invalidCommentPatternFailsOnCreate() {
        assertThrows(ConfigurationException.class,
                () -> SortedUniqueLines.create(new RawConfig("MANIFEST.in", Map.of("comment_pattern", "("))));
    }

    @Test
    void unknownOptionFailsOnCreate() {
        assertThrows(ConfigurationException.class,
                () -> SortedUniqueLines.create(new RawConfig("MANIFEST.in", Map.of("sort", "desc"))));
    }

    @Test
    void crlfTargetKeepsCrlf() {
        String actual = apply(strategy, "aaa\nccc\neee\n", "bbb\r\nddd\r\n");

        assertEquals("aaa\r\nbbb\r\nccc\r\nddd\r\neee\r\n", actual);
    }

    @Test
    void mergeIsAFixedPoint() {
        String target = "# Licensed under blah blah\n\ninclude a\n# dangling\n";

        String once = apply(strategy, TEMPLATE_WITH_HEADER, target);
        String twice = apply(strategy, TEMPLATE_WITH_HEADER, once);

        assertEquals(once, twice);
    }

    @Test
    void mergeWithoutHeaderIsAFixedPoint() {
        String template = "foo\n# attached\nbar\n";

        String once = apply(strategy, template, "baz\n# orphan\n");
        String twice = apply(strategy, template, once);

        assertEquals("# attached\nbar\nbaz\nfoo\n# orphan\n", once);
        assertEquals(once, twice);
    }

    @Test
    void headerWithoutBlankLineReplacesTargetHeader() {
        String template = "# License v2\ninclude b\ngraft a\n";
        String target = "# License v1\ninclude a\n";

        String once = apply(strategy, template, target);

        assertEquals("# License v2\ngraft a\ninclude a\ninclude b\n", once);
        assertEquals(once, apply(strategy, template, once));
    }

    @Test
    void templateHeaderReplacesSeparatedTargetHeader() {
        String template = "# License v2\ninclude b\n";
        String target = "# License v1\n\ninclude a\n";

        assertEquals("# License v2\ninclude a\ninclude b\n", apply(strategy, template, target));
    }
}
