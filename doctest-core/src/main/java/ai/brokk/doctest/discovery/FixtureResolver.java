package ai.brokk.doctest.discovery;

import ai.brokk.doctest.namespace.ModuleNamespace;
import ai.brokk.doctest.namespace.ModuleNotFoundException;
import ai.brokk.doctest.namespace.NameResolutionException;
import ai.brokk.doctest.source.ModuleEntity;
import ai.brokk.doctest.source.PythonPackages;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the fixture module of a doctest file: for {@code docs/guide.txt} and suffix {@code _fixt}, module
 * {@code guide_fixt}, imported with {@code docs/} appended to the search roots. A file without fixture still runs,
 * just without extra bindings.
 */
public final class FixtureResolver {
    private static final Logger logger = LogManager.getLogger(FixtureResolver.class);

    private final ModuleNamespace namespace;
    private final @Nullable String suffix;

    public FixtureResolver(ModuleNamespace namespace, @Nullable String suffix) {
        this.namespace = namespace;
        this.suffix = suffix;
    }

    public boolean isEnabled() {
        return suffix != null;
    }

    public Optional<ModuleEntity> resolve(Path file) {
        if (suffix == null) {
            return Optional.empty();
        }
        var fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }

        var fixtureName = PythonPackages.stripExtension(fileName.toString()) + suffix;
        var dir = file.toAbsolutePath().normalize().getParent();
        if (dir != null) {
            // left in place afterwards: other files in the same directory share it
            namespace.appendSearchRoot(dir);
        }

        try {
            var fixture = namespace.importModule(fixtureName);
            logger.debug("Fixture module {} resolved to {}", fixtureName, fixture);
            return Optional.of(fixture);
        } catch (ModuleNotFoundException e) {
            logger.debug("Could not import {}: {} ({})", fixtureName, e.getMessage(), namespace.searchRoots());
        } catch (NameResolutionException e) {
            logger.warn("Fixture module {} for {} could not be loaded", fixtureName, file, e);
        }
        return Optional.empty();
    }
}
