package ai.brokk.doctest.examples;

import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.SourceEntity;
import java.util.List;

/** Collects the example blocks attached to source entities. */
public interface ExampleFinder {

    /**
     * Blocks of a whole module: its own docstring and those of every class, function, method, property and nested
     * class reachable from it. Blocks are named after the module's dotted name.
     */
    default List<ExampleBlock> find(ModuleEntity module) {
        return find(module, module, module.name());
    }

    /**
     * Blocks of {@code entity} and of the members reachable from it, in definition order, with {@code name} as the
     * name of the entity's own block and as the prefix of its members' blocks. {@code module} supplies the filename.
     */
    List<ExampleBlock> find(SourceEntity entity, ModuleEntity module, String name);
}
