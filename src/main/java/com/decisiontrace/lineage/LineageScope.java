package com.decisiontrace.lineage;

/**
 * Where lineage references are allowed to resolve.
 */
public enum LineageScope {
    /** Parents must be records of the same run. */
    RUN_LOCAL,
    /** Parents may also be decisions of an explicitly supplied prior-run corpus. */
    GLOBAL
}
