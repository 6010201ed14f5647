package ai.brokk.doctest.discovery;

import ai.brokk.doctest.cases.DoctestGroup;

/**
 * Outcome of reading a doctest file that discovery applies to. Files discovery does not apply to produce no result at
 * all, so hosts can tell "not mine" from "mine, but empty".
 */
public sealed interface FileLoadResult permits FileLoadResult.Loaded, FileLoadResult.NoExamples {

    NoExamples NO_EXAMPLES = new NoExamples();

    /** The file held examples. */
    record Loaded(DoctestGroup group) implements FileLoadResult {}

    /** The file was read, but held no examples. */
    record NoExamples() implements FileLoadResult {}
}
