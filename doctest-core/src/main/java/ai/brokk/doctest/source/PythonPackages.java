package ai.brokk.doctest.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Optional;

/** Python package/module naming rules for files on disk. Only regular packages (with {@code __init__.py}) count. */
public final class PythonPackages {
    public static final String SOURCE_EXTENSION = ".py";
    public static final String INIT_FILE = "__init__.py";

    private PythonPackages() {}

    public static boolean isPackageDir(Path dir) {
        return Files.isDirectory(dir) && Files.isRegularFile(dir.resolve(INIT_FILE));
    }

    /**
     * Maps a compiled module file ({@code .pyc}, {@code .pyo}) to its source file and makes the result absolute.
     */
    public static Path src(Path file) {
        var abs = file.toAbsolutePath().normalize();
        var fileName = abs.getFileName();
        if (fileName == null) {
            return abs;
        }
        var name = fileName.toString();
        if (name.endsWith(".pyc") || name.endsWith(".pyo")) {
            return abs.resolveSibling(name.substring(0, name.length() - 1));
        }
        return abs;
    }

    /**
     * The dotted module name {@code file} would be imported as, found by walking up through package directories.
     * A package's {@code __init__.py} yields the package name. Returns empty for directories that are not packages
     * and for files that are not Python sources.
     *
     * <p>For example, with {@code pkg/__init__.py} present, {@code pkg/mod.py} maps to {@code pkg.mod}; without it,
     * to {@code mod}.
     */
    public static Optional<String> packageOf(Path file) {
        var source = src(file);
        var isDir = Files.isDirectory(source);
        var fileName = source.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        if ((isDir || !fileName.toString().endsWith(SOURCE_EXTENSION)) && !isPackageDir(source)) {
            return Optional.empty();
        }

        var parts = new ArrayDeque<String>();
        var base = isDir ? fileName.toString() : stripExtension(fileName.toString());
        if (!base.equals("__init__")) {
            parts.addFirst(base);
        }

        var dir = source.getParent();
        while (dir != null && dir.getFileName() != null && isPackageDir(dir)) {
            parts.addFirst(dir.getFileName().toString());
            dir = dir.getParent();
        }
        return Optional.of(String.join(".", parts));
    }

    public static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
