package ai.brokk.doctest.discovery;

import static org.junit.jupiter.api.Assertions.*;

import ai.brokk.doctest.DoctestPlugin;
import ai.brokk.doctest.api.AddressResolutionException;
import ai.brokk.doctest.api.DiscoveredTest;
import ai.brokk.doctest.api.Example;
import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.api.TestAddress;
import ai.brokk.doctest.cases.DocTestCase;
import ai.brokk.doctest.cases.DoctestGroup;
import ai.brokk.doctest.examples.ExampleFinder;
import ai.brokk.doctest.namespace.ModuleNamespace;
import ai.brokk.doctest.source.ClassEntity;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.SourceEntity;
import ai.brokk.doctest.testutil.InlineSourceTreeCreator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DoctestExtractorTest {

    private static final String MOD_PY =
            """
            def f():
                \"""
                >>> 1+1
                2
                \"""
            """;

    private static final String CLASS_PY =
            """
            class C:
                \"""
                >>> C().p
                1
                \"""

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

                def quiet(self):
                    \"""Nothing to run.\"""
            """;

    @Test
    public void functionDoctest_yieldsOneGroupWithOneCase() throws Exception {
        try (var tree = InlineSourceTreeCreator.code("", "pkg/__init__.py")
                .addFileContents(MOD_PY, "pkg/mod.py")
                .build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());
            var module = tree.namespace().importModule("pkg.mod");

            var groups = plugin.loadTestsFromModule(module);

            assertEquals(1, groups.size());
            var group = groups.get(0);
            assertFalse(group.canSplit());
            assertSame(module, group.context());
            assertEquals(1, group.size());

            var testCase = group.cases().get(0);
            assertEquals("pkg.mod.f", testCase.id());
            assertEquals(List.of(new Example("1+1\n", "2\n", 1, 4)), testCase.block().examples());
            assertEquals(
                    new TestAddress(tree.resolve("pkg/mod.py").toString(), "pkg.mod", "f"), testCase.address());
            assertEquals("f (pkg.mod)", testCase.toString());
            assertEquals("Doctest: pkg.mod.f", testCase.shortDescription());
            assertEquals(new TestAddress(tree.resolve("pkg/mod.py").toString(), "pkg.mod", null), group.address());
        }
    }

    @Test
    public void moduleWithWindowsLineEndings_keepsExpectedOutput() throws Exception {
        try (var tree = InlineSourceTreeCreator.code(MOD_PY.replace("\n", "\r\n"), "mod.py").build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());

            var groups = plugin.loadTestsFromModule(tree.namespace().importModule("mod"));

            assertEquals(1, groups.size());
            var testCase = groups.get(0).cases().get(0);
            assertEquals("mod.f", testCase.id());
            assertEquals(List.of(new Example("1+1\n", "2\n", 1, 4)), testCase.block().examples());
        }
    }

    @Test
    public void moduleWithoutExamples_yieldsNothing() throws Exception {
        try (var tree = InlineSourceTreeCreator.code("def f():\n    \"\"\"Prose only.\"\"\"\n", "mod.py")
                .addFileContents("x = 1\n", "bare.py")
                .build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());

            assertTrue(plugin.loadTestsFromModule(tree.namespace().importModule("mod")).isEmpty());
            assertTrue(plugin.loadTestsFromModule(tree.namespace().importModule("bare")).isEmpty());
        }
    }

    @Test
    public void optedOutModule_yieldsNothing() throws Exception {
        try (var tree = InlineSourceTreeCreator.code("__test__ = False\n" + MOD_PY, "mod.py").build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());

            assertTrue(plugin.loadTestsFromModule(tree.namespace().importModule("mod")).isEmpty());
        }
    }

    @Test
    public void unwantedModule_yieldsNothing() throws Exception {
        try (var tree = InlineSourceTreeCreator.code(MOD_PY, "test_mod.py").build()) {
            var module = tree.namespace().importModule("test_mod");

            var byDefault = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());
            var withTests = new DoctestPlugin(
                    DoctestOptions.builder().doctestTests(true).build(), tree.namespace());

            assertTrue(byDefault.loadTestsFromModule(module).isEmpty());
            assertEquals(List.of("test_mod.f"), withTests.loadTestsFromModule(module).get(0).ids());
        }
    }

    @Test
    public void moduleScan_sortsBlocksAndSkipsEmptyOnes() throws Exception {
        String modPy =
                """
                \"""
                >>> 0
                0
                \"""

                def b():
                    \"""
                    >>> 'b'
                    'b'
                    \"""

                def a():
                    \"""
                    >>> 'a'
                    'a'
                    \"""
                """;
        try (var tree = InlineSourceTreeCreator.code(modPy, "mod.py")
                .addFileContents(CLASS_PY, "klass.py")
                .build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());

            var mod = plugin.loadTestsFromModule(tree.namespace().importModule("mod"));
            var klass = plugin.loadTestsFromModule(tree.namespace().importModule("klass"));

            assertEquals(List.of("mod", "mod.a", "mod.b"), mod.get(0).ids());
            assertEquals(List.of("klass.C", "klass.C.m", "klass.C.p"), klass.get(0).ids());
        }
    }

    @Test
    public void moduleScan_fillsInMissingFilenames() throws Exception {
        ExampleFinder anonymous = new ExampleFinder() {
            @Override
            public List<ExampleBlock> find(SourceEntity entity, ModuleEntity module, String name) {
                var example = new Example("1\n", "1\n", 0, 0);
                return List.of(
                        new ExampleBlock(List.of(example), Map.of(), name + ".g", null, 3, ">>> 1\n1\n"),
                        new ExampleBlock(List.of(), Map.of(), name + ".h", null, 7, ""));
            }
        };
        try (var tree = InlineSourceTreeCreator.code("", "mod.py").build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace(), anonymous);

            var groups = plugin.loadTestsFromModule(tree.namespace().importModule("mod"));

            assertEquals(1, groups.get(0).size());
            var block = groups.get(0).cases().get(0).block();
            assertEquals(tree.resolve("mod.py").toString(), block.filename());
            assertEquals("mod.g", block.name());
        }
    }

    @Test
    public void makeTest_keepsDeclarationOrder_andAddressesTheGivenEntity() throws Exception {
        try (var tree = InlineSourceTreeCreator.code("", "pkg/__init__.py")
                .addFileContents(CLASS_PY, "pkg/klass.py")
                .build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());
            var module = tree.namespace().importModule("pkg.klass");
            var c = (ClassEntity) module.getAttribute("C").orElseThrow();
            var file = tree.resolve("pkg/klass.py").toString();

            var cases = plugin.makeTest(c, module);

            assertEquals(List.of("pkg.klass.C", "pkg.klass.C.m", "pkg.klass.C.p"), ids(cases));
            for (var testCase : cases) {
                assertSame(c, testCase.entity());
                assertEquals(new TestAddress(file, "pkg.klass", "C"), testCase.address());
            }
        }
    }

    @Test
    public void makeTest_onProperty_isAddressedThroughItsClass() throws Exception {
        try (var tree = InlineSourceTreeCreator.code(CLASS_PY, "klass.py").build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());
            var module = tree.namespace().importModule("klass");
            var c = (ClassEntity) module.getAttribute("C").orElseThrow();
            var p = c.getAttribute("p").orElseThrow();

            var cases = plugin.makeTest(p, c);

            assertEquals(1, cases.size());
            assertEquals("klass.p", cases.get(0).id());
            assertEquals(new TestAddress(tree.resolve("klass.py").toString(), "klass", "C.p"), cases.get(0).address());
        }
    }

    @Test
    public void makeTest_onPropertyWithoutItsClass_cannotBeAddressed() throws Exception {
        try (var tree = InlineSourceTreeCreator.code(CLASS_PY, "klass.py").build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());
            var module = tree.namespace().importModule("klass");
            var c = (ClassEntity) module.getAttribute("C").orElseThrow();
            var p = c.getAttribute("p").orElseThrow();

            var cases = plugin.makeTest(p, module);

            assertEquals(1, cases.size());
            var e = assertThrows(AddressResolutionException.class, () -> cases.get(0).address());
            assertEquals("p", e.getName());
        }
    }

    @Test
    public void makeTest_entityWithoutExamples_yieldsNothing() throws Exception {
        try (var tree = InlineSourceTreeCreator.code(CLASS_PY, "klass.py").build()) {
            var plugin = new DoctestPlugin(DoctestOptions.defaults(), tree.namespace());
            var c = (ClassEntity) tree.namespace().importModule("klass").getAttribute("C").orElseThrow();

            assertTrue(plugin.makeTest(c.getAttribute("quiet").orElseThrow(), c).isEmpty());
        }
    }

    @Test
    public void discoveryIsRepeatable() throws Exception {
        try (var tree = InlineSourceTreeCreator.code("", "pkg/__init__.py")
                .addFileContents(CLASS_PY, "pkg/klass.py")
                .build()) {
            var first = snapshot(new DoctestPlugin(DoctestOptions.defaults(), tree.namespace()));
            var second = snapshot(
                    new DoctestPlugin(DoctestOptions.defaults(), new ModuleNamespace(List.of(tree.root()))));

            assertEquals(first, second);
            assertEquals(3, first.size());
        }
    }

    private static List<String> snapshot(DoctestPlugin plugin) throws Exception {
        var out = new ArrayList<String>();
        var module = plugin.namespace().importModule("pkg.klass");
        for (DoctestGroup group : plugin.loadTestsFromModule(module)) {
            for (var testCase : group) {
                out.add(testCase.id() + " @ " + testCase.address());
            }
        }
        return out;
    }

    private static List<String> ids(List<DocTestCase> cases) {
        return cases.stream().map(DiscoveredTest::id).toList();
    }
}
