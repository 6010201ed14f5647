package ai.brokk.doctest.source;

import org.jetbrains.annotations.Nullable;

/** A module-level function, or a method of a class. */
public final class FunctionEntity implements ModuleMember {

    public enum Kind {
        FUNCTION,
        METHOD,
        STATIC_METHOD,
        CLASS_METHOD
    }

    private final String name;
    private final ModuleEntity module;
    private final @Nullable ClassEntity owner;
    private final Kind kind;
    private final @Nullable String docstring;
    private final int lineno;

    FunctionEntity(
            String name,
            ModuleEntity module,
            @Nullable ClassEntity owner,
            Kind kind,
            @Nullable String docstring,
            int lineno) {
        if ((owner == null) != (kind == Kind.FUNCTION)) {
            throw new IllegalArgumentException("Kind %s does not match owner %s".formatted(kind, owner));
        }
        this.name = name;
        this.module = module;
        this.owner = owner;
        this.kind = kind;
        this.docstring = docstring;
        this.lineno = lineno;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModuleEntity module() {
        return module;
    }

    /** The declaring class, or {@code null} for module-level functions. */
    public @Nullable ClassEntity owner() {
        return owner;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String callPath() {
        return owner == null ? name : owner.callPath() + "." + name;
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
        return "<function %s.%s>".formatted(module.name(), callPath());
    }
}
