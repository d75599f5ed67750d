package com.decisiontrace.tracer;

/**
 * How a recorder scope ended. Only {@link #EMITTED} produces a record.
 */
public enum ScopeOutcome {
    /** An action was supplied and the record was dispatched to every exporter. */
    EMITTED,
    /** Cancelled or interrupted before an action was supplied. */
    CANCELLED,
    /** The enclosed work threw before an action was supplied. */
    FAILED,
    /** Closed normally without an action; reported as an emission contract violation. */
    ABANDONED
}
