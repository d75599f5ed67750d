package com.decisiontrace.lineage;

/**
 * A lineage entry that did not resolve to a record of the graph: either
 * dangling, or resolved against an external corpus in global scope.
 */
public record LineageReference(String childId, String parentId) {}
