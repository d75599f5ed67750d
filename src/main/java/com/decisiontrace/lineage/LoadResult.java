package com.decisiontrace.lineage;

import com.decisiontrace.contract.DecisionRecord;

import java.util.List;

/**
 * Records decoded from a trace, plus the lines that could not be.
 */
public record LoadResult(
    List<DecisionRecord> records,
    List<LoadError> errors
) {

    public LoadResult {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }

    public static LoadResult of(List<DecisionRecord> records) {
        return new LoadResult(records, List.of());
    }
}
