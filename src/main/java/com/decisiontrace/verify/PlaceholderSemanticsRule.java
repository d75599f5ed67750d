package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Rejects records whose content still uses placeholder labels ("Plan A",
 * "Option 1") instead of naming what was actually decided.
 */
public class PlaceholderSemanticsRule implements VerificationRule {

    public static final String NAME = "placeholder_semantics";

    private final List<String> forbidden;

    public PlaceholderSemanticsRule(List<String> forbidden) {
        this.forbidden = List.copyOf(forbidden);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "context, logic and outcome contain none of the placeholder labels " + forbidden;
    }

    @Override
    public RuleResult evaluate(VerificationInput input) {
        List<Violation> violations = new ArrayList<>();
        if (forbidden.isEmpty()) {
            return RuleResult.of(NAME, violations);
        }
        for (DecisionRecord record : input.distinctRecords()) {
            TreeSet<String> hits = new TreeSet<>();
            collect(record.context(), hits);
            collect(record.logic(), hits);
            collect(record.outcome(), hits);
            if (!hits.isEmpty()) {
                violations.add(Violation.of(record.decisionId(), "placeholder labels found: " + hits));
            }
        }
        return RuleResult.of(NAME, violations);
    }

    private void collect(Object value, TreeSet<String> hits) {
        if (value instanceof String text) {
            for (String token : forbidden) {
                if (text.contains(token)) {
                    hits.add(token);
                }
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Object nested : map.values()) {
                collect(nested, hits);
            }
        } else if (value instanceof Collection<?> items) {
            for (Object nested : items) {
                collect(nested, hits);
            }
        }
    }
}
