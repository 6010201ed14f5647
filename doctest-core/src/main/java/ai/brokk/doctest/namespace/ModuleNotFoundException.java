package ai.brokk.doctest.namespace;

/** No search root contains a module or package with the requested dotted name. */
public class ModuleNotFoundException extends NameResolutionException {

    public ModuleNotFoundException(String moduleName) {
        super(moduleName, "No module named '%s'".formatted(moduleName));
    }
}
