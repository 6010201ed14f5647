package ai.brokk.doctest.examples;

import ai.brokk.doctest.api.Example;
import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.source.SourceContent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Splits documentation text into examples.
 *
 * <p>An example starts with a {@code >>> } line, continues with any {@code ... } lines, and expects the following
 * non-blank lines, up to the next prompt or blank line, as output. The common indentation of the text is removed
 * first; after that every line of an example must carry the indentation of its prompt.
 *
 * <p>Only {@code \n} ends a line. {@code \r\n} and {@code \r} are read as {@code \n}; other Unicode line separators
 * are ordinary characters.
 */
public final class DocTestParser {
    private static final int TAB_SIZE = 8;

    private static final Pattern EXAMPLE = Pattern.compile(
            "(?<source>(?:^(?<indent> *)>>>.*)(?:\\n *\\.\\.\\..*)*)\\n?"
                    + "(?<want>(?:(?! *$)(?! *>>>).+$\\n?)*)",
            Pattern.MULTILINE | Pattern.UNIX_LINES);
    private static final Pattern INDENT = Pattern.compile("^( *)(?=\\S)", Pattern.MULTILINE | Pattern.UNIX_LINES);
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile(" *(#.*)?", Pattern.UNIX_LINES);
    private static final Pattern TRAILING_BLANK = Pattern.compile(" *");

    /** Builds a block from {@code text}; the block may well have no examples. */
    public ExampleBlock parse(
            String text, String name, @Nullable String filename, @Nullable Integer lineno, Map<String, String> globals) {
        return new ExampleBlock(examples(text, name), globals, name, filename, lineno, text);
    }

    /**
     * The examples in {@code text}, in order.
     *
     * @throws ExampleSyntaxException if a prompt lacks its trailing blank or an example's lines are not consistently
     *     indented
     */
    public List<Example> examples(String text, String name) {
        var string = expandTabs(SourceContent.normalizeLineEndings(text));
        int minIndent = minIndent(string);
        if (minIndent > 0) {
            var lines = string.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                lines[i] = dropPrefix(lines[i], minIndent);
            }
            string = String.join("\n", lines);
        }

        var examples = new ArrayList<Example>();
        int charno = 0;
        int lineno = 0;
        Matcher m = EXAMPLE.matcher(string);
        while (m.find()) {
            lineno += countNewlines(string, charno, m.start());
            int indent = m.group("indent").length();
            var sourceLines = m.group("source").split("\n", -1);

            checkPromptBlank(sourceLines, indent, name, lineno);
            checkPrefix(sourceLines, 1, " ".repeat(indent) + ".", name, lineno);
            var source = new ArrayList<String>(sourceLines.length);
            for (var line : sourceLines) {
                source.add(dropPrefix(line, indent + 4));
            }

            var wantLines = new ArrayList<>(List.of(m.group("want").split("\n", -1)));
            if (wantLines.size() > 1
                    && TRAILING_BLANK.matcher(wantLines.get(wantLines.size() - 1)).matches()) {
                wantLines.remove(wantLines.size() - 1);
            }
            checkPrefix(wantLines.toArray(String[]::new), 0, " ".repeat(indent), name, lineno + sourceLines.length);
            var want = new ArrayList<String>(wantLines.size());
            for (var line : wantLines) {
                want.add(dropPrefix(line, indent));
            }

            var sourceText = String.join("\n", source);
            if (!BLANK_OR_COMMENT.matcher(sourceText).matches()) {
                examples.add(new Example(sourceText, String.join("\n", want), lineno, minIndent + indent));
            }
            lineno += countNewlines(string, m.start(), m.end());
            charno = m.end();
        }
        return examples;
    }

    private static void checkPromptBlank(String[] lines, int indent, String name, int lineno) {
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i];
            if (line.length() >= indent + 4 && line.charAt(indent + 3) != ' ') {
                throw new ExampleSyntaxException(
                        name,
                        lineno + i + 1,
                        "lacks blank after %s: '%s'".formatted(line.substring(indent, indent + 3), line));
            }
        }
    }

    private static void checkPrefix(String[] lines, int from, String prefix, String name, int lineno) {
        for (int i = from; i < lines.length; i++) {
            var line = lines[i];
            if (!line.isEmpty() && !line.startsWith(prefix)) {
                throw new ExampleSyntaxException(
                        name, lineno + i + 1, "has inconsistent leading whitespace: '%s'".formatted(line));
            }
        }
    }

    private static int minIndent(String s) {
        int min = -1;
        var m = INDENT.matcher(s);
        while (m.find()) {
            int len = m.group(1).length();
            if (min < 0 || len < min) {
                min = len;
            }
        }
        return Math.max(min, 0);
    }

    private static int countNewlines(String s, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static String dropPrefix(String line, int n) {
        return line.length() <= n ? "" : line.substring(n);
    }

    static String expandTabs(String s) {
        if (s.indexOf('\t') < 0) {
            return s;
        }
        var sb = new StringBuilder(s.length() + 16);
        int column = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\t') {
                int spaces = TAB_SIZE - (column % TAB_SIZE);
                sb.append(" ".repeat(spaces));
                column += spaces;
            } else {
                sb.append(c);
                column = (c == '\n' || c == '\r') ? 0 : column + 1;
            }
        }
        return sb.toString();
    }
}
