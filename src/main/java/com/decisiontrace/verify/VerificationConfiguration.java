package com.decisiontrace.verify;

import com.decisiontrace.export.RecordCodec;
import com.decisiontrace.lineage.DecisionTraceReader;
import com.decisiontrace.tracer.DecisionTraceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VerificationConfiguration {

    @Bean
    public DecisionTraceReader decisionTraceReader(RecordCodec codec) {
        return new DecisionTraceReader(codec);
    }

    @Bean
    public VerificationEngine verificationEngine(DecisionTraceProperties properties) {
        DecisionTraceProperties.Verification verification = properties.getVerification();
        return new VerificationEngine(
            VerificationRules.standard(
                verification.getForbiddenPlaceholders(),
                verification.getExpectedCounts(),
                verification.getRequiredEvidence()),
            properties.getLineageScope());
    }
}
