package ai.brokk.doctest.namespace;

import ai.brokk.doctest.source.ClassEntity;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.PythonPackages;
import ai.brokk.doctest.source.PythonSourceParser;
import ai.brokk.doctest.source.SourceEntity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The set of importable Python modules: an ordered list of search roots plus a cache of the modules parsed so far,
 * keyed by dotted name.
 *
 * <p>Search roots can only be appended; nothing is ever removed, so concurrent discovery passes may add roots without
 * coordinating. Name resolution reads the cache without locking and is not isolated from imports running on other
 * threads.
 */
public final class ModuleNamespace {
    private static final Logger logger = LogManager.getLogger(ModuleNamespace.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private final PythonSourceParser parser;
    private final CopyOnWriteArrayList<Path> searchRoots = new CopyOnWriteArrayList<>();
    private final Map<String, ModuleEntity> modules = new ConcurrentHashMap<>();

    public ModuleNamespace(List<Path> searchRoots) {
        this(new PythonSourceParser(), searchRoots);
    }

    public ModuleNamespace(PythonSourceParser parser, List<Path> searchRoots) {
        this.parser = parser;
        searchRoots.forEach(this::appendSearchRoot);
    }

    /** Appends {@code dir} to the search roots unless it is already present. Returns true if it was added. */
    public boolean appendSearchRoot(Path dir) {
        var normalized = dir.toAbsolutePath().normalize();
        boolean added = searchRoots.addIfAbsent(normalized);
        if (added) {
            logger.debug("Added search root {}", normalized);
        }
        return added;
    }

    public List<Path> searchRoots() {
        return List.copyOf(searchRoots);
    }

    public Optional<ModuleEntity> loadedModule(String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    /**
     * Returns the module named {@code moduleName}, parsing it on first use. The first search root that holds the
     * module wins; in each root a package directory shadows a module file of the same name, and every enclosing
     * directory has to be a package.
     */
    public ModuleEntity importModule(String moduleName) throws NameResolutionException {
        var cached = modules.get(moduleName);
        if (cached != null) {
            return cached;
        }

        var parts = moduleName.split("\\.", -1);
        if (Arrays.stream(parts).anyMatch(p -> !IDENTIFIER.matcher(p).matches())) {
            throw new NameResolutionException(moduleName, "Not a valid module name: '%s'".formatted(moduleName));
        }

        for (var root : searchRoots) {
            var file = locate(root, parts);
            if (file == null) {
                continue;
            }
            try {
                var module = parser.parseFile(moduleName, file);
                var raced = modules.putIfAbsent(moduleName, module);
                logger.debug("Imported module {} from {}", moduleName, file);
                return raced == null ? module : raced;
            } catch (IOException e) {
                throw new NameResolutionException(
                        moduleName, "Could not read module '%s' from %s".formatted(moduleName, file), e);
            }
        }
        throw new ModuleNotFoundException(moduleName);
    }

    private static @Nullable Path locate(Path root, String[] parts) {
        var dir = root;
        for (int i = 0; i < parts.length - 1; i++) {
            dir = dir.resolve(parts[i]);
            if (!PythonPackages.isPackageDir(dir)) {
                return null;
            }
        }
        var last = parts[parts.length - 1];
        var packageDir = dir.resolve(last);
        if (PythonPackages.isPackageDir(packageDir)) {
            return packageDir.resolve(PythonPackages.INIT_FILE);
        }
        var moduleFile = dir.resolve(last + PythonPackages.SOURCE_EXTENSION);
        return Files.isRegularFile(moduleFile) ? moduleFile : null;
    }

    /**
     * Resolves a dotted name to an entity: the longest importable prefix is imported, and the remaining segments are
     * looked up as attributes, one after the other.
     *
     * @throws ModuleNotFoundException if not even the first segment is importable
     * @throws NameResolutionException if an attribute along the way does not exist
     */
    public SourceEntity resolveName(String dottedName) throws NameResolutionException {
        var parts = dottedName.split("\\.", -1);
        ModuleEntity module = null;
        int consumed = parts.length;
        NameResolutionException lastFailure = null;
        while (consumed > 0) {
            var candidate = String.join(".", Arrays.copyOfRange(parts, 0, consumed));
            try {
                module = importModule(candidate);
                break;
            } catch (ModuleNotFoundException e) {
                lastFailure = e;
                consumed--;
            }
        }
        if (module == null) {
            throw lastFailure != null ? lastFailure : new ModuleNotFoundException(dottedName);
        }

        SourceEntity current = module;
        for (int i = consumed; i < parts.length; i++) {
            current = attribute(current, parts[i], dottedName);
        }
        return current;
    }

    private SourceEntity attribute(SourceEntity owner, String attribute, String dottedName)
            throws NameResolutionException {
        Optional<? extends SourceEntity> found;
        if (owner instanceof ModuleEntity module) {
            found = module.getAttribute(attribute);
        } else if (owner instanceof ClassEntity cls) {
            found = cls.getAttribute(attribute);
        } else {
            found = Optional.empty();
        }
        return found.orElseThrow(() -> new NameResolutionException(
                dottedName, "%s has no attribute '%s' (resolving '%s')".formatted(owner, attribute, dottedName)));
    }
}
