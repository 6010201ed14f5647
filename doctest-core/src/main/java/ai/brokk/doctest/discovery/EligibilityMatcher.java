package ai.brokk.doctest.discovery;

import ai.brokk.doctest.source.PythonPackages;
import java.nio.file.Path;
import java.util.List;

/** Decides which modules and files are scanned for doctests. */
public final class EligibilityMatcher {
    /** Never wanted as a module name. It is a file name, so it only shows up when a caller passes one. */
    static final String REJECTED_MODULE_NAME = PythonPackages.INIT_FILE;

    private final MatchRule rule;
    private final List<String> extensions;

    public EligibilityMatcher(MatchRule rule, List<String> extensions) {
        this.rule = rule;
        this.extensions = List.copyOf(extensions);
    }

    public static EligibilityMatcher from(DoctestOptions options) {
        return new EligibilityMatcher(MatchRule.from(options), options.extensions());
    }

    /**
     * Wanted when test-named modules are scanned too, or the name does not look like a test module, or an include
     * pattern matches; in every case only if no exclude pattern matches.
     */
    public boolean wantModule(String moduleName) {
        if (REJECTED_MODULE_NAME.equals(moduleName)) {
            return false;
        }
        boolean candidate =
                rule.alsoScanTestNamed() || !rule.looksLikeTest(moduleName) || rule.isIncluded(moduleName);
        return candidate && !rule.isExcluded(moduleName);
    }

    /** Python sources are always wanted; files with a doctest extension are wanted unless excluded. */
    public boolean wantFile(Path file) {
        var name = file.toString();
        if (name.endsWith(PythonPackages.SOURCE_EXTENSION)) {
            return true;
        }
        return hasDoctestExtension(file) && !rule.isExcluded(name);
    }

    public boolean hasDoctestExtension(Path file) {
        var name = file.toString();
        return extensions.stream().anyMatch(name::endsWith);
    }
}
