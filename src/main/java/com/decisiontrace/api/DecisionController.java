package com.decisiontrace.api;

import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.export.InMemoryRecordExporter;
import com.decisiontrace.tracer.DecisionInstrumentation;
import com.decisiontrace.tracer.ExportFailure;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records decisions computed outside the JVM.
 *
 * POST /v1/decisions   record-shaped body, emitted through one recorder scope
 * GET  /v1/decisions   records held by the in-memory sink
 */
@RestController
@RequestMapping("/v1/decisions")
public class DecisionController {

    private final DecisionInstrumentation instrumentation;
    private final InMemoryRecordExporter inMemory;

    public DecisionController(DecisionInstrumentation instrumentation, InMemoryRecordExporter inMemory) {
        this.instrumentation = instrumentation;
        this.inMemory = inMemory;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> record(@RequestBody Map<String, Object> decision,
                                      @RequestParam(required = false) String policyId) {
        DecisionInstrumentation.Emission emission = instrumentation.emit(decision, policyId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "recorded");
        body.put("decision_id", emission.record().decisionId());
        body.put("timestamp", emission.record().timestamp().toString());
        body.put("fully_delivered", emission.delivery().fullyDelivered());
        body.put("failed_exporters", emission.delivery().failures().stream()
            .map(ExportFailure::exporterName)
            .toList());
        return body;
    }

    @GetMapping
    public List<DecisionRecord> list(@RequestParam(required = false) String decisionType,
                                     @RequestParam(defaultValue = "100") int limit) {
        return inMemory.records().stream()
            .filter(record -> decisionType == null || decisionType.equals(record.decisionType()))
            .limit(Math.max(0, Math.min(limit, 1000)))
            .toList();
    }
}
