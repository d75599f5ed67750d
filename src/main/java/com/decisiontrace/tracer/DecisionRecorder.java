package com.decisiontrace.tracer;

import com.decisiontrace.contract.Actor;
import com.decisiontrace.contract.ContractViolationException;
import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.contract.EmissionContractViolation;
import com.decisiontrace.export.ExportException;
import com.decisiontrace.export.RecordExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scope for exactly one decision. Opened by {@link DecisionTracer}, given one
 * {@link ActionPayload}, and finalized by {@link #close()}, normally through
 * try-with-resources:
 *
 * <pre>{@code
 * try (DecisionRecorder recorder = tracer.open(options)) {
 *     recorder.action(ActionPayload.of(context, logic, outcome).withLineage(parentId));
 * }
 * }</pre>
 *
 * State moves OPEN to FINALIZED once; a finalized recorder cannot be reused.
 * An action accepted before close is always part of the emitted record, even
 * when the two calls race on different threads.
 * On close:
 * <ul>
 *   <li>with an action, the record is built, stamped and handed to every exporter
 *       once; exporter failures are collected in the {@link DeliveryReport}.</li>
 *   <li>without an action after {@link #cancel(String)}, a failure of the enclosed
 *       work, or on an interrupted thread, nothing is emitted and the scope is
 *       logged as cancelled or failed.</li>
 *   <li>without an action on a normal exit, nothing is emitted and an
 *       {@link EmissionContractViolation} is thrown.</li>
 * </ul>
 *
 * The recorder sets the decision MDC keys only around its own log lines, so a
 * scope may be opened on one thread and closed on another.
 */
public final class DecisionRecorder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DecisionRecorder.class);

    private final String decisionId;
    private final String decisionType;
    private final Actor actor;
    private final String tenantId;
    private final String environment;
    private final List<RecordExporter> exporters;
    private final MonotonicClock clock;
    private final DecisionIdRegistry registry;
    private final ReentrantLock transition = new ReentrantLock();

    private final AtomicReference<RecorderState> state = new AtomicReference<>(RecorderState.OPEN);
    private final AtomicReference<ActionPayload> action = new AtomicReference<>();
    private volatile ScopeOutcome abort;
    private volatile String abortReason;

    private volatile ScopeOutcome outcome;
    private volatile DecisionRecord record;
    private volatile DeliveryReport delivery;

    DecisionRecorder(String decisionId, String decisionType, Actor actor,
                     String tenantId, String environment, List<RecordExporter> exporters,
                     MonotonicClock clock, DecisionIdRegistry registry) {
        this.decisionId = decisionId;
        this.decisionType = decisionType;
        this.actor = actor;
        this.tenantId = tenantId;
        this.environment = environment;
        this.exporters = List.copyOf(exporters);
        this.clock = clock;
        this.registry = registry;
        TraceMdc.Restore mdc = TraceMdc.enter(decisionId, decisionType);
        try {
            log.debug("Opened recorder for decision {} ({}) with {} exporter(s)",
                decisionId, decisionType, this.exporters.size());
        } finally {
            mdc.restore();
        }
    }

    public String decisionId() {
        return decisionId;
    }

    public RecorderState state() {
        return state.get();
    }

    /**
     * Supplies the scope's single action. A second call, or a call after the
     * scope was finalized, is an emission contract violation.
     */
    public void action(ActionPayload payload) {
        if (payload == null) {
            throw new ContractViolationException("action payload is required");
        }
        if (payload.lineage().contains(decisionId)) {
            throw new ContractViolationException("decision " + decisionId + " cannot list itself in its lineage");
        }
        transition.lock();
        try {
            if (state.get() != RecorderState.OPEN) {
                throw new EmissionContractViolation(decisionId, "recorder is already finalized");
            }
            if (!action.compareAndSet(null, payload)) {
                throw new EmissionContractViolation(decisionId,
                    "an action payload was already supplied; a scope emits exactly one record");
            }
        } finally {
            transition.unlock();
        }
    }

    /**
     * Marks the scope as cancelled. If no action was supplied, closing emits
     * nothing and does not raise.
     */
    public void cancel(String reason) {
        markAborted(ScopeOutcome.CANCELLED, reason);
    }

    void markAborted(ScopeOutcome kind, String reason) {
        if (state.get() == RecorderState.OPEN && abort == null) {
            abortReason = reason;
            abort = kind;
        }
    }

    @Override
    public void close() {
        ActionPayload payload;
        transition.lock();
        try {
            if (!state.compareAndSet(RecorderState.OPEN, RecorderState.FINALIZED)) {
                return;
            }
            payload = action.get();
        } finally {
            transition.unlock();
        }
        TraceMdc.Restore mdc = TraceMdc.enter(decisionId, decisionType);
        try {
            if (payload == null) {
                finalizeWithoutAction();
                return;
            }
            DecisionRecord built = new DecisionRecord(
                decisionId,
                decisionType,
                clock.next(),
                tenantId,
                environment,
                payload.context(),
                actor,
                payload.logic(),
                payload.outcome(),
                payload.confidence(),
                payload.lineage()
            );
            record = built;
            delivery = dispatch(built);
            outcome = ScopeOutcome.EMITTED;
            if (delivery.fullyDelivered()) {
                log.info("Emitted decision {} ({}) to {} exporter(s)",
                    decisionId, decisionType, delivery.delivered().size());
            } else {
                log.warn("Emitted decision {} ({}) partially: delivered={}, failed={}",
                    decisionId, decisionType, delivery.delivered(),
                    delivery.failures().stream().map(ExportFailure::exporterName).toList());
            }
        } finally {
            mdc.restore();
        }
    }

    private void finalizeWithoutAction() {
        registry.release(decisionId);
        ScopeOutcome kind = abort;
        if (kind == null && Thread.currentThread().isInterrupted()) {
            kind = ScopeOutcome.CANCELLED;
            abortReason = "thread interrupted";
        }
        if (kind == null) {
            outcome = ScopeOutcome.ABANDONED;
            log.error("Decision {} ({}) finalized without an action payload; no record emitted",
                decisionId, decisionType);
            throw new EmissionContractViolation(decisionId,
                "scope finalized without an action payload; no record was emitted");
        }
        outcome = kind;
        log.warn("Decision {} ({}) {} before an action was supplied; no record emitted: {}",
            decisionId, decisionType, kind == ScopeOutcome.CANCELLED ? "cancelled" : "failed", abortReason);
    }

    private DeliveryReport dispatch(DecisionRecord built) {
        List<String> delivered = new ArrayList<>();
        List<ExportFailure> failures = new ArrayList<>();
        for (RecordExporter exporter : exporters) {
            try {
                exporter.append(built);
                delivered.add(exporter.name());
            } catch (ExportException ex) {
                log.error("Exporter {} failed to append decision {}: {}",
                    exporter.name(), decisionId, ex.getMessage());
                failures.add(ExportFailure.of(ex));
            } catch (RuntimeException ex) {
                log.error("Exporter {} failed unexpectedly on decision {}", exporter.name(), decisionId, ex);
                failures.add(new ExportFailure(exporter.name(), String.valueOf(ex.getMessage()), ex));
            }
        }
        return new DeliveryReport(decisionId, delivered, failures);
    }

    /** How the scope ended; empty while it is still open. */
    public Optional<ScopeOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    /** The emitted record; empty if the scope is open or emitted nothing. */
    public Optional<DecisionRecord> record() {
        return Optional.ofNullable(record);
    }

    /** Per-exporter delivery; empty unless a record was emitted. */
    public Optional<DeliveryReport> delivery() {
        return Optional.ofNullable(delivery);
    }
}
