package com.decisiontrace.tracer;

import com.decisiontrace.contract.Actor;
import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.contract.RecordContractValidator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Turns a task that computes its own record-shaped mapping into a traced task
 * with minimal call-site change:
 *
 * <pre>{@code
 * TracedTask<Plan> evaluate = instrumentation.wrap(plan -> policyGuard.evaluate(plan), "budget-policy");
 * Map<String, Object> decision = evaluate.apply(plan);
 * }</pre>
 *
 * The task's return value and exceptions reach the caller unchanged. A task that
 * throws emits nothing. Exporter failures are isolated in the delivery report and
 * never replace the task's result; a malformed mapping or a re-used decision_id
 * is raised to the caller.
 */
public class DecisionInstrumentation {

    private final DecisionTracer tracer;
    private final RecordContractValidator validator;

    public DecisionInstrumentation(DecisionTracer tracer, RecordContractValidator validator) {
        this.tracer = tracer;
        this.validator = validator;
    }

    public <T> TracedTask<T> wrap(Function<T, Map<String, Object>> task) {
        return wrap(task, null);
    }

    /**
     * @param policyId added to the record's {@code context.policy_id} unless the task set one
     */
    public <T> TracedTask<T> wrap(Function<T, Map<String, Object>> task, String policyId) {
        if (task instanceof TracedTask<T> traced) {
            return traced;
        }
        return new TracedTask<>(task, this, policyId);
    }

    /** Runs a task once and emits its decision. */
    public Map<String, Object> call(Supplier<Map<String, Object>> task) {
        Map<String, Object> result = task.get();
        emit(result, null);
        return result;
    }

    /**
     * Emits one record for an already computed mapping through a recorder scope.
     */
    public Emission emit(Map<String, Object> result, String policyId) {
        validator.validate(result);

        Actor actor = validator.toActor(result.get(DecisionRecord.ACTOR));
        RecorderOptions options = new RecorderOptions(
            (String) result.get(DecisionRecord.DECISION_TYPE),
            actor,
            (String) result.get(DecisionRecord.DECISION_ID),
            (String) result.get(DecisionRecord.TENANT_ID),
            (String) result.get(DecisionRecord.ENVIRONMENT),
            null);

        ActionPayload payload = new ActionPayload(
            withPolicy(asMap(result.get(DecisionRecord.CONTEXT)), policyId),
            asMap(validator.logicOf(result)),
            asMap(result.get(DecisionRecord.OUTCOME)),
            result.get(DecisionRecord.CONFIDENCE) instanceof Number n ? n.doubleValue() : null,
            lineageOf(result.get(DecisionRecord.LINEAGE)));

        DecisionRecorder recorder = tracer.open(options);
        try (recorder) {
            try {
                recorder.action(payload);
            } catch (RuntimeException ex) {
                recorder.markAborted(ScopeOutcome.FAILED, ex.getMessage());
                throw ex;
            }
        }
        return new Emission(
            recorder.record().orElseThrow(),
            recorder.delivery().orElseThrow());
    }

    private static Map<String, Object> withPolicy(Map<String, Object> context, String policyId) {
        if (policyId == null || context.containsKey("policy_id")) {
            return context;
        }
        Map<String, Object> enriched = new LinkedHashMap<>(context);
        enriched.put("policy_id", policyId);
        return enriched;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static List<String> lineageOf(Object value) {
        if (!(value instanceof List<?> parents)) {
            return List.of();
        }
        List<String> lineage = new ArrayList<>(parents.size());
        for (Object parent : parents) {
            lineage.add((String) parent);
        }
        return lineage;
    }

    /** The record a traced call produced and where it was delivered. */
    public record Emission(DecisionRecord record, DeliveryReport delivery) {}
}
