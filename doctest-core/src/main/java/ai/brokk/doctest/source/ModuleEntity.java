package ai.brokk.doctest.source;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A parsed Python module. Top-level classes and functions are its members, in definition order; a later definition
 * of the same name replaces the earlier one but keeps its position.
 */
public final class ModuleEntity implements SourceEntity {
    private final String name;
    private final @Nullable Path location;
    private final @Nullable String docstring;
    private final DiscoveryOverride override;
    private final Map<String, ModuleMember> members = new LinkedHashMap<>();

    ModuleEntity(String name, @Nullable Path location, @Nullable String docstring, DiscoveryOverride override) {
        this.name = name;
        this.location = location;
        this.docstring = docstring;
        this.override = override;
    }

    void addMember(ModuleMember member) {
        members.put(member.name(), member);
    }

    @Override
    public String name() {
        return name;
    }

    /** The file the module was parsed from; {@code null} for modules built from in-memory source. */
    public @Nullable Path location() {
        return location;
    }

    @Override
    public @Nullable String docstring() {
        return docstring;
    }

    @Override
    public Integer lineno() {
        return 0;
    }

    public DiscoveryOverride discoveryOverride() {
        return override;
    }

    public boolean isPackage() {
        return location != null
                && location.getFileName() != null
                && PythonPackages.INIT_FILE.equals(location.getFileName().toString());
    }

    public Collection<ModuleMember> members() {
        return Collections.unmodifiableCollection(members.values());
    }

    public Optional<ModuleMember> getAttribute(String attribute) {
        return Optional.ofNullable(members.get(attribute));
    }

    @Override
    public String toString() {
        return "<module '%s' from '%s'>".formatted(name, location == null ? "<string>" : location);
    }
}
