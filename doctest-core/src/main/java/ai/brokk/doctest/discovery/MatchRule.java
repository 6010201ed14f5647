package ai.brokk.doctest.discovery;

import java.util.List;
import java.util.regex.Pattern;

/** The module and file name rules discovery applies. Patterns are searched for, not matched in full. */
public record MatchRule(List<Pattern> include, List<Pattern> exclude, boolean alsoScanTestNamed, Pattern testMatch) {

    public MatchRule {
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
    }

    public static MatchRule from(DoctestOptions options) {
        return new MatchRule(options.include(), options.exclude(), options.doctestTests(), options.testMatch());
    }

    boolean looksLikeTest(String name) {
        return testMatch.matcher(name).find();
    }

    boolean isIncluded(String name) {
        return anyFound(include, name);
    }

    boolean isExcluded(String name) {
        return anyFound(exclude, name);
    }

    private static boolean anyFound(List<Pattern> patterns, String s) {
        return patterns.stream().anyMatch(p -> p.matcher(s).find());
    }
}
