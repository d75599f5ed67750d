package com.decisiontrace.verify;

import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.lineage.LineageGraph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * What every rule sees: the lineage graph and the raw records it was built from.
 */
public record VerificationInput(
    LineageGraph graph,
    List<DecisionRecord> records
) {

    public VerificationInput {
        records = List.copyOf(records);
    }

    /**
     * Raw records with identical copies removed, in load order. Per-record rules
     * use this so a duplicated record is reported once (duplication itself has
     * its own rule).
     */
    public List<DecisionRecord> distinctRecords() {
        return new ArrayList<>(new LinkedHashSet<>(records));
    }
}
