package ai.brokk.doctest.source;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns the source text of a Python string literal into its value, as far as docstrings need it. f-strings and
 * bytes literals are never docstrings and decode to empty.
 */
final class DocstringLiterals {

    private DocstringLiterals() {}

    static Optional<String> decode(String literal) {
        int quoteStart = 0;
        while (quoteStart < literal.length() && Character.isLetter(literal.charAt(quoteStart))) {
            quoteStart++;
        }
        var prefix = literal.substring(0, quoteStart).toLowerCase(Locale.ROOT);
        if (prefix.contains("f") || prefix.contains("b")) {
            return Optional.empty();
        }

        var body = literal.substring(quoteStart);
        String delimiter;
        if (body.startsWith("\"\"\"") || body.startsWith("'''")) {
            delimiter = body.substring(0, 3);
        } else if (body.startsWith("\"") || body.startsWith("'")) {
            delimiter = body.substring(0, 1);
        } else {
            return Optional.empty();
        }
        if (body.length() < 2 * delimiter.length() || !body.endsWith(delimiter)) {
            return Optional.empty();
        }

        var content = body.substring(delimiter.length(), body.length() - delimiter.length());
        return Optional.of(prefix.contains("r") ? content : unescape(content));
    }

    private static String unescape(String content) {
        var sb = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = content.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> {} // line continuation
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000B');
                case 'x' -> i = appendCodePoint(sb, content, i, 2);
                case 'u' -> i = appendCodePoint(sb, content, i, 4);
                case 'U' -> i = appendCodePoint(sb, content, i, 8);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < content.length() && end < i + 2 && isOctal(content.charAt(end))) {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(content.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        // unknown escapes are kept verbatim, as Python does
                        sb.append('\\').append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendCodePoint(StringBuilder sb, String content, int start, int digits) {
        int end = start + digits;
        if (end > content.length()) {
            sb.append(content, start - 2, content.length());
            return content.length();
        }
        try {
            sb.appendCodePoint(Integer.parseInt(content.substring(start, end), 16));
        } catch (IllegalArgumentException e) {
            // malformed or out-of-range escape: keep the raw text
            sb.append(content, start - 2, end);
        }
        return end;
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }
}
