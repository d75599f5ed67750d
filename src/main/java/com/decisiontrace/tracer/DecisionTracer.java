package com.decisiontrace.tracer;

import com.decisiontrace.contract.Actor;
import com.decisiontrace.contract.ContractViolationException;
import com.decisiontrace.export.RecordExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Opens recorder scopes for one run.
 *
 * The tracer owns the run's decision-id registry (an id can back at most one
 * record per run) and the monotonic clock that stamps finalized records.
 * Scopes may be opened concurrently from any number of threads.
 */
public class DecisionTracer {

    private static final Logger log = LoggerFactory.getLogger(DecisionTracer.class);

    private final TraceDefaults defaults;
    private final MonotonicClock clock;
    private final DecisionIdRegistry registry = new DecisionIdRegistry();

    public DecisionTracer(TraceDefaults defaults, Clock clock) {
        this.defaults = defaults;
        this.clock = new MonotonicClock(clock);
    }

    public TraceDefaults defaults() {
        return defaults;
    }

    public DecisionRecorder open(String decisionType, Actor actor) {
        return open(RecorderOptions.of(decisionType, actor));
    }

    /**
     * @throws ContractViolationException if the type, actor or exporters are missing
     * @throws DuplicateDecisionException if the decision id was already used in this run
     */
    public DecisionRecorder open(RecorderOptions options) {
        if (options.decisionType() == null || options.decisionType().isBlank()) {
            throw new ContractViolationException("decision_type is required to open a recorder");
        }
        if (options.actor() == null) {
            throw new ContractViolationException("actor is required to open a recorder");
        }
        List<RecordExporter> exporters = options.exporters() != null && !options.exporters().isEmpty()
            ? options.exporters()
            : defaults.exporters();
        if (exporters.isEmpty()) {
            throw new ContractViolationException("at least one exporter is required to open a recorder");
        }

        String decisionId = options.decisionId();
        if (decisionId == null) {
            decisionId = UUID.randomUUID().toString();
        } else if (decisionId.isBlank()) {
            throw new ContractViolationException("decision_id must not be blank when provided");
        }
        if (!registry.claim(decisionId)) {
            log.warn("Rejected re-use of decision_id {} ({})", decisionId, options.decisionType());
            throw new DuplicateDecisionException(decisionId);
        }

        return new DecisionRecorder(
            decisionId,
            options.decisionType(),
            options.actor(),
            options.tenantId() != null ? options.tenantId() : defaults.tenantId(),
            options.environment() != null ? options.environment() : defaults.environment(),
            exporters,
            clock,
            registry);
    }

    /**
     * Runs {@code body} inside a recorder scope and finalizes it on every exit
     * path. If the body throws before supplying an action, the scope ends as
     * FAILED (or CANCELLED for cancellation and interrupts) without a record and
     * the body's exception propagates unchanged. If it returns without an action,
     * an {@link com.decisiontrace.contract.EmissionContractViolation} is thrown.
     * The decision MDC keys are set on the calling thread while the body runs.
     */
    public <R, E extends Exception> R record(RecorderOptions options, ScopedDecision<R, E> body) throws E {
        DecisionRecorder recorder = open(options);
        TraceMdc.Restore mdc = TraceMdc.enter(recorder.decisionId(), options.decisionType());
        boolean completed = false;
        try {
            R result = body.run(recorder);
            completed = true;
            return result;
        } catch (CancellationException ex) {
            recorder.markAborted(ScopeOutcome.CANCELLED, "cancelled: " + ex.getMessage());
            throw ex;
        } finally {
            try {
                if (!completed) {
                    recorder.markAborted(
                        Thread.currentThread().isInterrupted() ? ScopeOutcome.CANCELLED : ScopeOutcome.FAILED,
                        "enclosed work did not complete");
                }
                recorder.close();
            } finally {
                mdc.restore();
            }
        }
    }

    /** Whether the id is held by an open scope or an emitted record in this run. */
    public boolean isClaimed(String decisionId) {
        return registry.isClaimed(decisionId);
    }

    @FunctionalInterface
    public interface ScopedDecision<R, E extends Exception> {
        R run(DecisionRecorder recorder) throws E;
    }
}
