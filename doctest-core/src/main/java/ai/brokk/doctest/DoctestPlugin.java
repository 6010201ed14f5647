package ai.brokk.doctest;

import ai.brokk.doctest.cases.AddressResolver;
import ai.brokk.doctest.cases.DocTestCase;
import ai.brokk.doctest.cases.DoctestGroup;
import ai.brokk.doctest.discovery.DoctestExtractor;
import ai.brokk.doctest.discovery.DoctestOptions;
import ai.brokk.doctest.discovery.EligibilityMatcher;
import ai.brokk.doctest.discovery.FileLoadResult;
import ai.brokk.doctest.discovery.FixtureResolver;
import ai.brokk.doctest.examples.DocTestParser;
import ai.brokk.doctest.examples.DocstringExampleFinder;
import ai.brokk.doctest.examples.ExampleFinder;
import ai.brokk.doctest.namespace.ModuleNamespace;
import ai.brokk.doctest.run.CaseResult;
import ai.brokk.doctest.run.ExampleRunner;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.SourceEntity;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for a host test framework: the two gate queries it asks before discovery, and the three discovery
 * entry points for modules, single entities and doctest files.
 */
public final class DoctestPlugin {
    private final DoctestOptions options;
    private final ModuleNamespace namespace;
    private final EligibilityMatcher matcher;
    private final DoctestExtractor extractor;

    public DoctestPlugin(DoctestOptions options, ModuleNamespace namespace) {
        this(options, namespace, new DocstringExampleFinder());
    }

    public DoctestPlugin(DoctestOptions options, ModuleNamespace namespace, ExampleFinder finder) {
        this.options = options;
        this.namespace = namespace;
        this.matcher = EligibilityMatcher.from(options);
        this.extractor = new DoctestExtractor(
                matcher,
                finder,
                new DocTestParser(),
                new FixtureResolver(namespace, options.fixtureSuffix()),
                new AddressResolver(namespace));
    }

    public DoctestOptions options() {
        return options;
    }

    public ModuleNamespace namespace() {
        return namespace;
    }

    public boolean wantModule(String moduleName) {
        return matcher.wantModule(moduleName);
    }

    public boolean wantFile(Path file) {
        return matcher.wantFile(file);
    }

    public List<DoctestGroup> loadTestsFromModule(ModuleEntity module) {
        return extractor.loadTestsFromModule(module);
    }

    public List<DocTestCase> makeTest(SourceEntity entity, SourceEntity parent) {
        return extractor.makeTest(entity, parent);
    }

    public List<FileLoadResult> loadTestsFromFile(Path file) {
        return extractor.loadTestsFromFile(file);
    }

    /** Runs a discovered group with the trace hook configured in {@link #options()}. */
    public List<CaseResult> run(DoctestGroup group, ExampleRunner runner) {
        return group.run(runner, options.traceControl());
    }
}
