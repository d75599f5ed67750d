package com.decisiontrace.tracer;

import com.decisiontrace.export.RecordExporter;

import java.util.List;

/**
 * Process-wide recorder defaults: scoping metadata and the exporter set every
 * scope delivers to unless it names its own. Built once at startup and never
 * mutated afterwards; pass it to {@link DecisionTracer} instead of keeping a global.
 */
public record TraceDefaults(
    String tenantId,
    String environment,
    List<RecordExporter> exporters
) {

    public TraceDefaults {
        exporters = exporters == null ? List.of() : List.copyOf(exporters);
    }
}
