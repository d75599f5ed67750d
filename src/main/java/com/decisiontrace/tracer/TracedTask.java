package com.decisiontrace.tracer;

import java.util.Map;
import java.util.function.Function;

/**
 * A task with decision emission attached. Wrapping a traced task again returns
 * the same instance, so a decision is never emitted twice by stacked wrappers.
 */
public final class TracedTask<T> implements Function<T, Map<String, Object>> {

    private final Function<T, Map<String, Object>> delegate;
    private final DecisionInstrumentation instrumentation;
    private final String policyId;

    TracedTask(Function<T, Map<String, Object>> delegate,
               DecisionInstrumentation instrumentation,
               String policyId) {
        this.delegate = delegate;
        this.instrumentation = instrumentation;
        this.policyId = policyId;
    }

    @Override
    public Map<String, Object> apply(T input) {
        Map<String, Object> result = delegate.apply(input);
        instrumentation.emit(result, policyId);
        return result;
    }
}
