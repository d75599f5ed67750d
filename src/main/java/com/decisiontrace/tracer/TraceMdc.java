package com.decisiontrace.tracer;

import org.slf4j.MDC;

/**
 * MDC keys for log lines written on behalf of a decision. Set only for the
 * duration of a call on the current thread and never left behind on a thread
 * that merely opened a scope.
 */
final class TraceMdc {

    static final String DECISION_ID = "decisionId";
    static final String DECISION_TYPE = "decisionType";

    private TraceMdc() {}

    /**
     * Sets the decision keys and returns a handle that restores whatever the
     * thread had before, so nested scopes leave the outer scope's keys intact.
     */
    static Restore enter(String decisionId, String decisionType) {
        String previousId = MDC.get(DECISION_ID);
        String previousType = MDC.get(DECISION_TYPE);
        MDC.put(DECISION_ID, decisionId);
        MDC.put(DECISION_TYPE, decisionType);
        return () -> {
            restore(DECISION_ID, previousId);
            restore(DECISION_TYPE, previousType);
        };
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @FunctionalInterface
    interface Restore {
        void restore();
    }
}
