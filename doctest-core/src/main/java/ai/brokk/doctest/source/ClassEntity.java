package ai.brokk.doctest.source;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A class definition. Members are methods, properties and nested classes, in definition order. */
public final class ClassEntity implements ModuleMember {
    private final String name;
    private final ModuleEntity module;
    private final String callPath;
    private final @Nullable String docstring;
    private final int lineno;
    private final Map<String, SourceEntity> members = new LinkedHashMap<>();

    ClassEntity(String name, ModuleEntity module, @Nullable ClassEntity enclosing, @Nullable String docstring, int lineno) {
        this.name = name;
        this.module = module;
        this.callPath = enclosing == null ? name : enclosing.callPath() + "." + name;
        this.docstring = docstring;
        this.lineno = lineno;
    }

    void addMember(SourceEntity member) {
        if (member instanceof ModuleEntity) {
            throw new IllegalArgumentException("A module cannot be a class member: " + member);
        }
        members.put(member.name(), member);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModuleEntity module() {
        return module;
    }

    @Override
    public String callPath() {
        return callPath;
    }

    @Override
    public @Nullable String docstring() {
        return docstring;
    }

    @Override
    public Integer lineno() {
        return lineno;
    }

    public Collection<SourceEntity> members() {
        return Collections.unmodifiableCollection(members.values());
    }

    public Optional<SourceEntity> getAttribute(String attribute) {
        return Optional.ofNullable(members.get(attribute));
    }

    @Override
    public String toString() {
        return "<class '%s.%s'>".formatted(module.name(), callPath);
    }
}
