package ai.brokk.doctest.cases;

import ai.brokk.doctest.api.AddressResolutionException;
import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.api.TestAddress;
import ai.brokk.doctest.source.PythonPackages;
import ai.brokk.doctest.source.SourceEntity;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * A test case for one example block found in a docstring.
 *
 * <p>Blocks found by scanning a single entity are named relative to that entity (just {@code f}, not
 * {@code pkg.mod.f}), so {@link #id()} qualifies the name with the package of the block's file. Those cases also
 * keep the entity itself, which makes their address independent of name lookups; see {@link AddressResolver}.
 */
public final class DocTestCase implements RunnableDoctest {
    private final ExampleBlock block;
    private final @Nullable SourceEntity entity;
    private final @Nullable SourceEntity parent;
    private final AddressResolver addressResolver;
    private final String id;

    public DocTestCase(ExampleBlock block, AddressResolver addressResolver) {
        this(block, null, null, addressResolver);
    }

    /**
     * @param entity the entity the block was discovered on, or {@code null} when only the block name is known
     * @param parent the entity {@code entity} was reached through; only used to address properties
     */
    public DocTestCase(
            ExampleBlock block,
            @Nullable SourceEntity entity,
            @Nullable SourceEntity parent,
            AddressResolver addressResolver) {
        this.block = block;
        this.entity = entity;
        this.parent = parent;
        this.addressResolver = addressResolver;
        this.id = qualifiedName(block);
    }

    @Override
    public ExampleBlock block() {
        return block;
    }

    public @Nullable SourceEntity entity() {
        return entity;
    }

    public @Nullable SourceEntity parent() {
        return parent;
    }

    /** The block name, qualified with the package of the block's file as it was when the case was created. */
    @Override
    public String id() {
        return id;
    }

    private static String qualifiedName(ExampleBlock block) {
        var name = block.name();
        var filename = block.filename();
        if (filename != null) {
            var pkg = PythonPackages.packageOf(Path.of(filename));
            if (pkg.isPresent() && !name.startsWith(pkg.get())) {
                name = pkg.get() + "." + name;
            }
        }
        return name;
    }

    @Override
    public TestAddress address() throws AddressResolutionException {
        return addressResolver.address(this);
    }

    @Override
    public String shortDescription() {
        return "Doctest: " + id();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof DocTestCase other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    /** {@code leaf (dotted.prefix)}. */
    @Override
    public String toString() {
        int dot = id.lastIndexOf('.');
        return dot < 0 ? id + " ()" : "%s (%s)".formatted(id.substring(dot + 1), id.substring(0, dot));
    }
}
