package com.decisiontrace.tracer;

import com.decisiontrace.lineage.LineageScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "decision-trace")
public class DecisionTraceProperties {

    private String tenantId = "default";
    private String environment = "local";
    private LineageScope lineageScope = LineageScope.RUN_LOCAL;
    private Sink sink = new Sink();
    private Verification verification = new Verification();

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }
    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }
    public LineageScope getLineageScope() { return lineageScope; }
    public void setLineageScope(LineageScope lineageScope) { this.lineageScope = lineageScope; }
    public Sink getSink() { return sink; }
    public void setSink(Sink sink) { this.sink = sink; }
    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }

    public static class Sink {
        /** JSONL file to append records to; blank keeps records in memory only. */
        private String path = "";
        private boolean syncOnAppend = false;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public boolean isSyncOnAppend() { return syncOnAppend; }
        public void setSyncOnAppend(boolean syncOnAppend) { this.syncOnAppend = syncOnAppend; }
    }

    public static class Verification {
        /** Labels that betray placeholder semantics when they appear in a record. */
        private List<String> forbiddenPlaceholders = new ArrayList<>(List.of(
            "Plan A", "Plan B", "Plan C", "Option 1", "Option 2", "Option 3"));
        /** Exact number of records expected per decision type; empty disables the check. */
        private Map<String, Integer> expectedCounts = new LinkedHashMap<>();

        /** Logic keys each decision type must carry with a non-empty value. */
        private Map<String, List<String>> requiredEvidence = new LinkedHashMap<>();

        public List<String> getForbiddenPlaceholders() { return forbiddenPlaceholders; }
        public void setForbiddenPlaceholders(List<String> forbiddenPlaceholders) {
            this.forbiddenPlaceholders = forbiddenPlaceholders;
        }
        public Map<String, Integer> getExpectedCounts() { return expectedCounts; }
        public void setExpectedCounts(Map<String, Integer> expectedCounts) { this.expectedCounts = expectedCounts; }
        public Map<String, List<String>> getRequiredEvidence() { return requiredEvidence; }
        public void setRequiredEvidence(Map<String, List<String>> requiredEvidence) {
            this.requiredEvidence = requiredEvidence;
        }
    }
}
