package ai.brokk.doctest.discovery;

import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.cases.AddressResolver;
import ai.brokk.doctest.cases.DocFileCase;
import ai.brokk.doctest.cases.DocTestCase;
import ai.brokk.doctest.cases.DoctestGroup;
import ai.brokk.doctest.examples.DocTestParser;
import ai.brokk.doctest.examples.ExampleFinder;
import ai.brokk.doctest.examples.ExampleSyntaxException;
import ai.brokk.doctest.source.DiscoveryOverride;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.ModuleMember;
import ai.brokk.doctest.source.SourceContent;
import ai.brokk.doctest.source.SourceEntity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Turns modules, single entities and doctest files into doctest cases and groups. */
public final class DoctestExtractor {
    private static final Logger logger = LogManager.getLogger(DoctestExtractor.class);

    static final String FILE_GLOBAL = "__file__";

    private final EligibilityMatcher matcher;
    private final ExampleFinder finder;
    private final DocTestParser parser;
    private final FixtureResolver fixtureResolver;
    private final AddressResolver addressResolver;

    public DoctestExtractor(
            EligibilityMatcher matcher,
            ExampleFinder finder,
            DocTestParser parser,
            FixtureResolver fixtureResolver,
            AddressResolver addressResolver) {
        this.matcher = matcher;
        this.finder = finder;
        this.parser = parser;
        this.fixtureResolver = fixtureResolver;
        this.addressResolver = addressResolver;
    }

    /**
     * All doctests of {@code module} as a single group with the module as context, or nothing when the module is not
     * wanted, opted out through {@code __test__ = False}, or has no examples. Cases follow the blocks' natural order.
     */
    public List<DoctestGroup> loadTestsFromModule(ModuleEntity module) {
        if (!matcher.wantModule(module.name())) {
            logger.debug("Doctest doesn't want module {}", module);
            return List.of();
        }
        if (module.discoveryOverride() == DiscoveryOverride.DISABLED) {
            logger.debug("Module {} disables doctest discovery", module.name());
            return List.of();
        }

        var blocks = new ArrayList<>(finder.find(module));
        if (blocks.isEmpty()) {
            return List.of();
        }
        blocks.sort(null);

        var moduleFile = module.location();
        var cases = new ArrayList<DocTestCase>();
        for (var block : blocks) {
            if (block.isEmpty()) {
                continue;
            }
            if (block.filename() == null && moduleFile != null) {
                block = block.withFilename(moduleFile.toString());
            }
            cases.add(new DocTestCase(block, addressResolver));
        }
        if (cases.isEmpty()) {
            return List.of();
        }
        logger.debug("Found {} doctest(s) in module {}", cases.size(), module.name());
        return List.of(DoctestGroup.forModule(cases, module));
    }

    /**
     * Doctests of one entity met while the host walks a module, in definition order. Every case remembers
     * {@code entity} so its address does not depend on re-resolving names later.
     *
     * @param parent what {@code entity} was found in: its class for methods and properties, else its module
     */
    public List<DocTestCase> makeTest(SourceEntity entity, SourceEntity parent) {
        var module = moduleOf(parent);
        if (module == null) {
            logger.debug("Cannot tell the module of {} (parent {}); no doctests", entity, parent);
            return List.of();
        }

        var cases = new ArrayList<DocTestCase>();
        for (var block : finder.find(entity, module, entity.name())) {
            if (block.isEmpty()) {
                continue;
            }
            cases.add(new DocTestCase(block, entity, parent, addressResolver));
        }
        return cases;
    }

    /**
     * The doctest file at {@code file} as one group, context being its fixture module if any. Returns nothing when
     * the file has none of the doctest extensions or cannot be read, and {@link FileLoadResult#NO_EXAMPLES} when it
     * holds no examples.
     */
    public List<FileLoadResult> loadTestsFromFile(Path file) {
        if (!matcher.hasDoctestExtension(file)) {
            return List.of();
        }

        String text;
        try {
            text = SourceContent.normalizeLineEndings(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.warn("Could not read doctest file {}", file, e);
            return List.of();
        }

        var fixture = fixtureResolver.resolve(file).orElse(null);
        var fileName = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        var filename = file.toString();

        ExampleBlock block;
        try {
            block = parser.parse(text, fileName, filename, 0, Map.of(FILE_GLOBAL, filename));
        } catch (ExampleSyntaxException e) {
            logger.warn("Skipping doctest file {}: {}", file, e.getMessage());
            return List.of();
        }
        if (block.isEmpty()) {
            return List.of(FileLoadResult.NO_EXAMPLES);
        }
        var group = DoctestGroup.forFile(List.of(new DocFileCase(block)), file, fixture);
        return List.of(new FileLoadResult.Loaded(group));
    }

    private static @Nullable ModuleEntity moduleOf(SourceEntity entity) {
        if (entity instanceof ModuleEntity module) {
            return module;
        }
        if (entity instanceof ModuleMember member) {
            return member.module();
        }
        return null;
    }
}
