package com.decisiontrace.tracer;

import com.decisiontrace.contract.RecordContractValidator;
import com.decisiontrace.export.InMemoryRecordExporter;
import com.decisiontrace.export.JsonlFileExporter;
import com.decisiontrace.export.RecordCodec;
import com.decisiontrace.export.RecordExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
@EnableConfigurationProperties(DecisionTraceProperties.class)
public class TracerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecordCodec recordCodec() {
        return new RecordCodec();
    }

    @Bean(destroyMethod = "close")
    public InMemoryRecordExporter inMemoryRecordExporter() {
        return new InMemoryRecordExporter();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnExpression("!'${decision-trace.sink.path:}'.isBlank()")
    public JsonlFileExporter jsonlFileExporter(DecisionTraceProperties properties, RecordCodec codec) {
        return new JsonlFileExporter(
            Path.of(properties.getSink().getPath()),
            codec,
            properties.getSink().isSyncOnAppend());
    }

    /**
     * Every scope delivers to the in-memory sink, plus the JSONL file when one is configured.
     */
    @Bean
    public TraceDefaults traceDefaults(DecisionTraceProperties properties,
                                       InMemoryRecordExporter inMemory,
                                       ObjectProvider<JsonlFileExporter> file) {
        List<RecordExporter> exporters = new ArrayList<>();
        exporters.add(inMemory);
        file.ifAvailable(exporters::add);
        return new TraceDefaults(properties.getTenantId(), properties.getEnvironment(), exporters);
    }

    @Bean
    public DecisionTracer decisionTracer(TraceDefaults defaults, Clock clock) {
        return new DecisionTracer(defaults, clock);
    }

    @Bean
    public DecisionInstrumentation decisionInstrumentation(DecisionTracer tracer,
                                                           RecordContractValidator validator) {
        return new DecisionInstrumentation(tracer, validator);
    }
}
