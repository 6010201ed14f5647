package ai.brokk.doctest.discovery;

import ai.brokk.doctest.run.TraceControl;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Doctest discovery settings, as parsed by the host framework.
 *
 * @param doctestTests also look for doctests in modules whose names look like test modules
 * @param extensions extra file extensions (e.g. {@code .txt}) whose files are read as doctest files
 * @param fixtureSuffix suffix appended to a doctest file's base name to find its fixture module, or {@code null}
 * @param include module name patterns that are scanned even when they look like test modules
 * @param exclude module name and file path patterns that are never scanned
 * @param testMatch the host's "this is a test module" name pattern
 * @param traceControl access to the trace hook that must survive debugger use
 */
public record DoctestOptions(
        boolean doctestTests,
        List<String> extensions,
        @Nullable String fixtureSuffix,
        List<Pattern> include,
        List<Pattern> exclude,
        Pattern testMatch,
        TraceControl traceControl) {

    /** The host's default test-name pattern: {@code test} or {@code Test} at the start or after a separator. */
    public static final Pattern DEFAULT_TEST_MATCH = Pattern.compile("(?:^|[\\x08_./-])[Tt]est");

    public DoctestOptions {
        extensions = List.copyOf(extensions);
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
        if (fixtureSuffix != null && fixtureSuffix.isEmpty()) {
            fixtureSuffix = null;
        }
    }

    public static DoctestOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean doctestTests;
        private final List<String> extensions = new ArrayList<>();
        private @Nullable String fixtureSuffix;
        private final List<Pattern> include = new ArrayList<>();
        private final List<Pattern> exclude = new ArrayList<>();
        private Pattern testMatch = DEFAULT_TEST_MATCH;
        private TraceControl traceControl = TraceControl.NONE;

        private Builder() {}

        public Builder doctestTests(boolean doctestTests) {
            this.doctestTests = doctestTests;
            return this;
        }

        /** Adds an extension; a missing leading dot is not added, matching is a plain suffix test. */
        public Builder extension(String extension) {
            this.extensions.add(extension);
            return this;
        }

        public Builder fixtureSuffix(@Nullable String fixtureSuffix) {
            this.fixtureSuffix = fixtureSuffix;
            return this;
        }

        public Builder include(String regex) {
            this.include.add(Pattern.compile(regex));
            return this;
        }

        public Builder exclude(String regex) {
            this.exclude.add(Pattern.compile(regex));
            return this;
        }

        public Builder testMatch(Pattern testMatch) {
            this.testMatch = testMatch;
            return this;
        }

        public Builder traceControl(TraceControl traceControl) {
            this.traceControl = traceControl;
            return this;
        }

        public DoctestOptions build() {
            return new DoctestOptions(
                    doctestTests, extensions, fixtureSuffix, include, exclude, testMatch, traceControl);
        }
    }
}
