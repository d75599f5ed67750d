package com.decisiontrace.tracer;

import java.util.List;

/**
 * Per-exporter result of dispatching one record. A decision is fully traced
 * only when every attached exporter accepted it.
 */
public record DeliveryReport(
    String decisionId,
    List<String> delivered,
    List<ExportFailure> failures
) {

    public DeliveryReport {
        delivered = List.copyOf(delivered);
        failures = List.copyOf(failures);
    }

    public boolean fullyDelivered() {
        return failures.isEmpty();
    }
}
