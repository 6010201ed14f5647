package ai.brokk.doctest.source;

/** A class or function defined, directly or through enclosing classes, in a module. */
public sealed interface ModuleMember extends SourceEntity permits ClassEntity, FunctionEntity {

    ModuleEntity module();

    /** Dotted path from the module to this member, e.g. {@code Outer.Inner.method}. */
    String callPath();
}
