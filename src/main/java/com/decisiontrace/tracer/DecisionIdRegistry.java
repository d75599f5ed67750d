package com.decisiontrace.tracer;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decision ids claimed by open or emitted scopes within one run.
 */
class DecisionIdRegistry {

    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    boolean claim(String decisionId) {
        return claimed.add(decisionId);
    }

    void release(String decisionId) {
        claimed.remove(decisionId);
    }

    boolean isClaimed(String decisionId) {
        return claimed.contains(decisionId);
    }
}
