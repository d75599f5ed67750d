package com.decisiontrace.lineage;

import java.util.List;

/**
 * One decision_id carried by structurally different records. The id is
 * excluded from the graph: the input is corrupt, not merely semantically weak.
 *
 * @param variants        number of distinct record contents seen for the id
 * @param differingFields record fields that differ between the first two variants
 */
public record StructuralConflict(
    String decisionId,
    int variants,
    List<String> differingFields
) {

    public StructuralConflict {
        differingFields = List.copyOf(differingFields);
    }
}
