package ai.brokk.doctest.examples;

import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.source.ClassEntity;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.SourceEntity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * {@link ExampleFinder} over parsed docstrings. Entities without a docstring, or with an empty one, produce no
 * block; a docstring without examples still produces an (empty) block. A docstring that breaks the example grammar
 * is reported and skipped, so one bad docstring does not hide the rest of the module.
 */
public final class DocstringExampleFinder implements ExampleFinder {
    private static final Logger logger = LogManager.getLogger(DocstringExampleFinder.class);

    private final DocTestParser parser;

    public DocstringExampleFinder() {
        this(new DocTestParser());
    }

    public DocstringExampleFinder(DocTestParser parser) {
        this.parser = parser;
    }

    @Override
    public List<ExampleBlock> find(SourceEntity entity, ModuleEntity module, String name) {
        var location = module.location();
        var filename = location == null ? null : location.toString();
        var blocks = new ArrayList<ExampleBlock>();
        Set<SourceEntity> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(entity, name, filename, blocks, seen);
        return blocks;
    }

    private void collect(
            SourceEntity entity, String name, @Nullable String filename, List<ExampleBlock> out, Set<SourceEntity> seen) {
        if (!seen.add(entity)) {
            return;
        }

        var docstring = entity.docstring();
        if (docstring != null && !docstring.isEmpty()) {
            try {
                out.add(parser.parse(docstring, name, filename, entity.lineno(), Map.of()));
            } catch (ExampleSyntaxException e) {
                logger.warn("Skipping examples of {}: {}", name, e.getMessage());
            }
        }

        if (entity instanceof ModuleEntity module) {
            for (var member : module.members()) {
                collect(member, name + "." + member.name(), filename, out, seen);
            }
        } else if (entity instanceof ClassEntity cls) {
            for (var member : cls.members()) {
                collect(member, name + "." + member.name(), filename, out, seen);
            }
        }
    }
}
