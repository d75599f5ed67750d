package com.decisiontrace.api;

import com.decisiontrace.export.InMemoryRecordExporter;
import com.decisiontrace.lineage.DecisionTraceReader;
import com.decisiontrace.lineage.LoadResult;
import com.decisiontrace.verify.VerificationEngine;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Runs the verification battery over a trace.
 *
 * POST /v1/verifications           JSONL trace in the body
 * GET  /v1/verifications/current   records emitted by this process so far
 */
@RestController
@RequestMapping("/v1/verifications")
public class VerificationController {

    private final VerificationEngine engine;
    private final DecisionTraceReader reader;
    private final InMemoryRecordExporter inMemory;

    public VerificationController(VerificationEngine engine,
                                  DecisionTraceReader reader,
                                  InMemoryRecordExporter inMemory) {
        this.engine = engine;
        this.reader = reader;
        this.inMemory = inMemory;
    }

    @PostMapping(consumes = {MediaType.TEXT_PLAIN_VALUE, "application/x-ndjson"})
    public Map<String, Object> verify(@RequestBody String trace) {
        LoadResult loaded = reader.parse(trace, "request");
        return engine.verify(loaded).toView();
    }

    @GetMapping("/current")
    public Map<String, Object> verifyCurrent() {
        return engine.verify(inMemory.records()).toView();
    }
}
