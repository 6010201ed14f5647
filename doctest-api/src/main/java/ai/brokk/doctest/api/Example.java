package ai.brokk.doctest.api;

/**
 * A single input/expected-output pair of an example block.
 *
 * @param source the input, always newline-terminated
 * @param want the expected output, newline-terminated, or empty when nothing is printed
 * @param lineno 0-based line of the {@code >>>} prompt, relative to the start of the block text
 * @param indent column of the {@code >>>} prompt
 */
public record Example(String source, String want, int lineno, int indent) {

    public Example {
        if (!source.endsWith("\n")) {
            source = source + "\n";
        }
        if (!want.isEmpty() && !want.endsWith("\n")) {
            want = want + "\n";
        }
        if (lineno < 0 || indent < 0) {
            throw new IllegalArgumentException("lineno and indent must be non-negative, got %d/%d"
                    .formatted(lineno, indent));
        }
    }
}
