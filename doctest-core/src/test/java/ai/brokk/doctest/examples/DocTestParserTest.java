package ai.brokk.doctest.examples;

import static org.junit.jupiter.api.Assertions.*;

import ai.brokk.doctest.api.Example;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DocTestParserTest {

    private final DocTestParser parser = new DocTestParser();

    @Test
    public void indentedDocstring_examplesWithOutput() {
        String docstring = "\n    Adds numbers.\n\n    >>> 1+1\n    2\n    >>> x = 3\n    >>> x\n    3\n    ";

        var examples = parser.examples(docstring, "pkg.mod.f");

        assertEquals(
                List.of(new Example("1+1\n", "2\n", 3, 4), new Example("x = 3\n", "", 5, 4), new Example("x\n", "3\n", 6, 4)),
                examples);
    }

    @Test
    public void continuationLinesBelongToTheSource() {
        String text = ">>> def g():\n...     return 1\n>>> g()\n1\n";

        var examples = parser.examples(text, "t");

        assertEquals(2, examples.size());
        assertEquals("def g():\n    return 1\n", examples.get(0).source());
        assertEquals("", examples.get(0).want());
        assertEquals(2, examples.get(1).lineno());
    }

    @Test
    public void outputStopsAtBlankLine() {
        String text = ">>> print('a')\na\n\nProse that is not output.\n";

        var examples = parser.examples(text, "t");

        assertEquals(1, examples.size());
        assertEquals("a\n", examples.get(0).want());
    }

    @Test
    public void commentOnlyPromptsAreNotExamples() {
        var examples = parser.examples(">>> # nothing here\n>>> 1\n1\n", "t");

        assertEquals(1, examples.size());
        assertEquals("1\n", examples.get(0).source());
    }

    @Test
    public void textWithoutPromptsHasNoExamples() {
        var block = parser.parse("Just prose.\n", "t", "t.txt", 0, Map.of());

        assertTrue(block.isEmpty());
        assertEquals("Just prose.\n", block.docstring());
        assertEquals("t.txt", block.filename());
        assertEquals(0, block.lineno());
    }

    @Test
    public void promptWithoutBlank_isRejected() {
        var e = assertThrows(ExampleSyntaxException.class, () -> parser.examples("text\n>>>1+1\n2\n", "pkg.mod.f"));

        assertEquals(2, e.getLine());
        assertEquals("pkg.mod.f", e.getBlockName());
        assertTrue(e.getMessage().contains("lacks blank after >>>"), e.getMessage());
    }

    @Test
    public void outputLessIndentedThanPrompt_isRejected() {
        var e = assertThrows(
                ExampleSyntaxException.class, () -> parser.examples("    >>> print(1)\n  1\n", "pkg.mod.f"));

        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("inconsistent leading whitespace"), e.getMessage());
    }

    @Test
    public void windowsLineEndingsReadAsNewlines() {
        var crlf = parser.examples(">>> 1+1\r\n2\r\n", "t");
        var cr = parser.examples(">>> 1+1\r2\r>>> 3\r3\r", "t");

        assertEquals(List.of(new Example("1+1\n", "2\n", 0, 0)), crlf);
        assertEquals(List.of(new Example("1+1\n", "2\n", 0, 0), new Example("3\n", "3\n", 2, 0)), cr);
    }

    @Test
    public void unicodeLineSeparatorsDoNotEndALine() {
        var examples = parser.examples(">>> s\nab\u2028cd\n>>> t\u0085u\n", "t");

        assertEquals(2, examples.size());
        assertEquals("ab\u2028cd\n", examples.get(0).want());
        assertEquals("t\u0085u\n", examples.get(1).source());
    }

    @Test
    public void tabsExpandToEightColumns() {
        assertEquals("        x", DocTestParser.expandTabs("\tx"));
        assertEquals("ab      x", DocTestParser.expandTabs("ab\tx"));
        assertEquals("a\n        b", DocTestParser.expandTabs("a\n\tb"));
    }
}
