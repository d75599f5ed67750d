package com.decisiontrace.tracer;

import com.decisiontrace.contract.Actor;
import com.decisiontrace.export.RecordExporter;

import java.util.List;

/**
 * What a recorder scope needs before it opens. Null tenant, environment and
 * exporters fall back to {@link TraceDefaults}; a null decision id is minted.
 */
public record RecorderOptions(
    String decisionType,
    Actor actor,
    String decisionId,
    String tenantId,
    String environment,
    List<RecordExporter> exporters
) {

    public RecorderOptions {
        exporters = exporters == null ? null : List.copyOf(exporters);
    }

    public static RecorderOptions of(String decisionType, Actor actor) {
        return new RecorderOptions(decisionType, actor, null, null, null, null);
    }

    public RecorderOptions withDecisionId(String id) {
        return new RecorderOptions(decisionType, actor, id, tenantId, environment, exporters);
    }

    public RecorderOptions withScope(String tenant, String env) {
        return new RecorderOptions(decisionType, actor, decisionId, tenant, env, exporters);
    }

    public RecorderOptions withExporters(RecordExporter... sinks) {
        return new RecorderOptions(decisionType, actor, decisionId, tenantId, environment, List.of(sinks));
    }
}
