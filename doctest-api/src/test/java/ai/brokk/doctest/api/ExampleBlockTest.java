package ai.brokk.doctest.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

public class ExampleBlockTest {

    private static ExampleBlock block(String name, @Nullable String filename, @Nullable Integer lineno) {
        return new ExampleBlock(List.of(), Map.of(), name, filename, lineno, "");
    }

    @Test
    public void naturalOrder_nameThenFilenameThenLine_unknownsFirst() {
        var blocks = new ArrayList<>(List.of(
                block("m.b", "a.py", 1),
                block("m.a", "b.py", 9),
                block("m.a", "a.py", 5),
                block("m.a", "a.py", null),
                block("m.a", null, 7)));

        blocks.sort(null);

        assertEquals(
                List.of(
                        block("m.a", null, 7),
                        block("m.a", "a.py", null),
                        block("m.a", "a.py", 5),
                        block("m.a", "b.py", 9),
                        block("m.b", "a.py", 1)),
                blocks);
    }

    @Test
    public void withFilename_returnsACopy() {
        var original = block("m.f", null, 3);

        var filled = original.withFilename("/src/m.py");

        assertNull(original.filename());
        assertEquals("/src/m.py", filled.filename());
        assertEquals(original.name(), filled.name());
        assertEquals(original.lineno(), filled.lineno());
    }

    @Test
    public void examplesAreCopiedAndNewlineTerminated() {
        var examples = new ArrayList<Example>();
        examples.add(new Example("1+1", "2", 0, 4));
        var block = new ExampleBlock(examples, Map.of(), "m.f", "m.py", 0, ">>> 1+1\n2");
        examples.clear();

        assertEquals(1, block.examples().size());
        assertEquals("1+1\n", block.examples().get(0).source());
        assertEquals("2\n", block.examples().get(0).want());
        assertFalse(block.isEmpty());
        assertEquals("<ExampleBlock m.f from m.py:1 (1 example)>", block.toString());
    }

    @Test
    public void emptyWantStaysEmpty() {
        assertEquals("", new Example("x = 1", "", 0, 0).want());
        assertThrows(IllegalArgumentException.class, () -> new Example("x", "", -1, 0));
    }
}
