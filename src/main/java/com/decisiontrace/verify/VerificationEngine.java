package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.lineage.LineageGraph;
import com.decisiontrace.lineage.LineageScope;
import com.decisiontrace.lineage.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Offline verifier for a completed run.
 *
 * Builds a fresh {@link LineageGraph} from the loaded records, evaluates every
 * rule of the battery against it, and assembles a {@link VerificationReport}.
 * A pass always completes: a defective record shows up as violations, never as
 * an exception that would hide the rest of the run.
 */
public class VerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final List<VerificationRule> rules;
    private final LineageScope scope;

    public VerificationEngine(List<VerificationRule> rules, LineageScope scope) {
        this.rules = List.copyOf(rules);
        this.scope = scope;
    }

    public List<VerificationRule> rules() {
        return rules;
    }

    public LineageScope scope() {
        return scope;
    }

    public VerificationReport verify(Collection<DecisionRecord> records) {
        return verify(LoadResult.of(new ArrayList<>(records)), Set.of());
    }

    public VerificationReport verify(LoadResult loaded) {
        return verify(loaded, Set.of());
    }

    /**
     * @param externalIds decision ids of prior runs that lineage may point to
     *                    when the engine runs in global scope
     */
    public VerificationReport verify(LoadResult loaded, Set<String> externalIds) {
        LineageGraph graph = LineageGraph.build(loaded.records(), scope, externalIds);
        VerificationInput input = new VerificationInput(graph, loaded.records());

        List<RuleResult> results = new ArrayList<>(rules.size());
        for (VerificationRule rule : rules) {
            RuleResult result = rule.evaluate(input);
            if (!result.passed()) {
                log.info("Rule {} failed for {} decision(s): {}",
                    rule.name(), result.violators().size(), result.violators());
            }
            results.add(result);
        }

        boolean passed = loaded.errors().isEmpty() && results.stream().allMatch(RuleResult::passed);
        VerificationReport report = new VerificationReport(
            passed,
            loaded.records().size(),
            results,
            loaded.errors(),
            graph.structuralConflicts());

        log.info("Verified {} record(s) against {} rule(s): passed={}, failed_rules={}, load_errors={}, conflicts={}",
            report.recordCount(), rules.size(), passed, report.failedRules(),
            loaded.errors().size(), graph.structuralConflicts().size());
        return report;
    }
}
