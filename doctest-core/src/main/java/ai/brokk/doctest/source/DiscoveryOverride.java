package ai.brokk.doctest.source;

/** Value of a module-level {@code __test__} assignment. */
public enum DiscoveryOverride {
    /** No boolean {@code __test__} assignment at module level. */
    UNSET,
    /** {@code __test__ = True}. */
    ENABLED,
    /** {@code __test__ = False}: the module opts out of discovery. */
    DISABLED
}
