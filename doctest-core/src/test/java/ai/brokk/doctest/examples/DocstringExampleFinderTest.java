package ai.brokk.doctest.examples;

import static org.junit.jupiter.api.Assertions.*;

import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.source.PythonSourceParser;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DocstringExampleFinderTest {

    private static final String MOD_PY =
            """
            \"""
            >>> 1
            1
            \"""

            def b():
                \"""
                >>> 'b'
                'b'
                \"""

            def a():
                ""

            class C:
                \"""No examples here.\"""

                def m(self):
                    \"""
                    >>> 2
                    2
                    \"""

                @property
                def p(self):
                    \"""
                    >>> 3
                    3
                    \"""

            def broken():
                \"""
                >>>oops
                \"""
            """;

    private final PythonSourceParser parser = new PythonSourceParser();
    private final DocstringExampleFinder finder = new DocstringExampleFinder();

    @Test
    public void wholeModule_inDefinitionOrder_namedFromModule() {
        var module = parser.parse("pkg.mod", Path.of("/src/pkg/mod.py"), MOD_PY);

        var blocks = finder.find(module);

        assertEquals(
                List.of("pkg.mod", "pkg.mod.b", "pkg.mod.C", "pkg.mod.C.m", "pkg.mod.C.p"),
                blocks.stream().map(ExampleBlock::name).toList());
        var expectedFile = Path.of("/src/pkg/mod.py").toString();
        blocks.forEach(b -> assertEquals(expectedFile, b.filename()));
    }

    @Test
    public void docstringWithoutExamples_stillYieldsAnEmptyBlock() {
        var module = parser.parse("pkg.mod", null, MOD_PY);

        var classBlock = finder.find(module).stream()
                .filter(b -> b.name().equals("pkg.mod.C"))
                .findFirst()
                .orElseThrow();

        assertTrue(classBlock.isEmpty());
        assertNull(classBlock.filename());
    }

    @Test
    public void singleEntity_namedFromTheGivenName() {
        var module = parser.parse("pkg.mod", null, MOD_PY);
        var c = module.getAttribute("C").orElseThrow();

        var blocks = finder.find(c, module, "C");

        assertEquals(List.of("C", "C.m", "C.p"), blocks.stream().map(ExampleBlock::name).toList());
        assertEquals("2\n", blocks.get(1).examples().get(0).want());
    }

    @Test
    public void blockLinenoIsTheDefinitionLine() {
        var module = parser.parse("pkg.mod", null, MOD_PY);

        var b = finder.find(module.getAttribute("b").orElseThrow(), module, "b").get(0);

        assertEquals(5, b.lineno());
    }
}
