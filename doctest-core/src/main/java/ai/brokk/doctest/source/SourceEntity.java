package ai.brokk.doctest.source;

import org.jetbrains.annotations.Nullable;

/**
 * Something documentation can be attached to: a module, a class, a function or method, or a property.
 *
 * <p>Modules, classes and functions can always tell where they live (see {@link ModuleMember}). Properties cannot:
 * like a property descriptor, a {@link PropertyEntity} holds no reference to the class that declares it.
 */
public sealed interface SourceEntity permits ModuleEntity, ModuleMember, PropertyEntity {

    /** The entity's own name: the dotted name for modules, the simple name for everything else. */
    String name();

    @Nullable
    String docstring();

    /** 0-based line of the definition, or {@code null} when unknown. */
    @Nullable
    Integer lineno();
}
