package ai.brokk.doctest.source;

import org.jetbrains.annotations.Nullable;

/**
 * A {@code @property} declared in a class. Knows nothing about its class: the owner can only be
 * recovered from a dotted name, by resolving everything but the last segment.
 */
public final class PropertyEntity implements SourceEntity {
    private final String name;
    private final @Nullable String docstring;
    private final int lineno;

    PropertyEntity(String name, @Nullable String docstring, int lineno) {
        this.name = name;
        this.docstring = docstring;
        this.lineno = lineno;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public @Nullable String docstring() {
        return docstring;
    }

    @Override
    public Integer lineno() {
        return lineno;
    }

    @Override
    public String toString() {
        return "<property " + name + ">";
    }
}
