package ai.brokk.doctest.api;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The examples found in one piece of documentation text: a docstring of a source entity, or a whole text file.
 *
 * <p>Blocks are immutable. A block whose finder could not tell where it came from has a {@code null} filename; the
 * discovery engine may fill it in afterwards through {@link #withFilename(String)}, which returns a copy.
 *
 * <p>Blocks order by name, then filename, then line; unknown filenames and lines sort first.
 */
public record ExampleBlock(
        List<Example> examples,
        Map<String, String> globals,
        String name,
        @Nullable String filename,
        @Nullable Integer lineno,
        String docstring)
        implements Comparable<ExampleBlock> {

    private static final Comparator<ExampleBlock> ORDER = Comparator.comparing(ExampleBlock::name)
            .thenComparing(ExampleBlock::filename, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ExampleBlock::lineno, Comparator.nullsFirst(Comparator.naturalOrder()));

    public ExampleBlock {
        examples = List.copyOf(examples);
        globals = Map.copyOf(globals);
    }

    /** True when the documentation text held no {@code >>>} examples at all. */
    public boolean isEmpty() {
        return examples.isEmpty();
    }

    public ExampleBlock withFilename(String newFilename) {
        return new ExampleBlock(examples, globals, name, newFilename, lineno, docstring);
    }

    @Override
    public int compareTo(ExampleBlock other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        var where = filename == null ? "unknown file" : filename;
        var line = lineno == null ? "?" : String.valueOf(lineno + 1);
        var plural = examples.size() == 1 ? "" : "s";
        return "<ExampleBlock %s from %s:%s (%d example%s)>".formatted(name, where, line, examples.size(), plural);
    }
}
