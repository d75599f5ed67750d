package com.decisiontrace.lineage;

import com.decisiontrace.contract.DecisionRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

/**
 * Directed graph of a run's decisions: one node per decision_id, one edge from
 * each record to every parent named in its lineage.
 *
 * Built once per analysis pass from a closed set of records and never mutated.
 * Records repeated with identical content collapse into one node and are counted
 * as duplicates; records sharing an id with different content are a
 * {@link StructuralConflict} and their id is left out of the node set.
 */
public final class LineageGraph {

    /** Timeline order: timestamp first (missing timestamps first), then decision_id. */
    public static final Comparator<DecisionRecord> TIMELINE = Comparator
        .comparing(DecisionRecord::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(DecisionRecord::decisionId);

    private final LineageScope scope;
    private final Map<String, DecisionRecord> nodes;
    private final Map<String, List<String>> parents;
    private final Map<String, List<String>> children;
    private final List<LineageReference> dangling;
    private final List<LineageReference> external;
    private final Map<String, Integer> duplicates;
    private final List<StructuralConflict> conflicts;
    private final List<List<String>> cycles;

    private LineageGraph(LineageScope scope,
                         Map<String, DecisionRecord> nodes,
                         Map<String, List<String>> parents,
                         Map<String, List<String>> children,
                         List<LineageReference> dangling,
                         List<LineageReference> external,
                         Map<String, Integer> duplicates,
                         List<StructuralConflict> conflicts) {
        this.scope = scope;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.parents = Collections.unmodifiableMap(parents);
        this.children = Collections.unmodifiableMap(children);
        this.dangling = List.copyOf(dangling);
        this.external = List.copyOf(external);
        this.duplicates = Collections.unmodifiableMap(duplicates);
        this.conflicts = List.copyOf(conflicts);
        this.cycles = findCycles();
    }

    public static LineageGraph build(Collection<DecisionRecord> records) {
        return build(records, LineageScope.RUN_LOCAL, Set.of());
    }

    /**
     * @param externalIds decisions of prior runs that lineage may resolve to;
     *                    only consulted in {@link LineageScope#GLOBAL} scope
     * @throws IllegalArgumentException if a record has no decision_id
     */
    public static LineageGraph build(Collection<DecisionRecord> records,
                                     LineageScope scope,
                                     Set<String> externalIds) {
        Map<String, List<DecisionRecord>> byId = new TreeMap<>();
        for (DecisionRecord record : records) {
            if (record.decisionId() == null || record.decisionId().isBlank()) {
                throw new IllegalArgumentException("record without decision_id cannot be placed in a lineage graph");
            }
            byId.computeIfAbsent(record.decisionId(), id -> new ArrayList<>()).add(record);
        }

        Map<String, DecisionRecord> nodes = new TreeMap<>();
        Map<String, Integer> duplicates = new TreeMap<>();
        List<StructuralConflict> conflicts = new ArrayList<>();
        Set<String> conflicted = new HashSet<>();

        for (Map.Entry<String, List<DecisionRecord>> entry : byId.entrySet()) {
            List<DecisionRecord> group = entry.getValue();
            List<DecisionRecord> variants = new ArrayList<>(new LinkedHashSet<>(group));
            if (variants.size() > 1) {
                conflicts.add(new StructuralConflict(entry.getKey(), variants.size(),
                    differingFields(variants.get(0), variants.get(1))));
                conflicted.add(entry.getKey());
                continue;
            }
            nodes.put(entry.getKey(), variants.get(0));
            if (group.size() > 1) {
                duplicates.put(entry.getKey(), group.size());
            }
        }

        Map<String, List<String>> parents = new TreeMap<>();
        Map<String, List<String>> children = new TreeMap<>();
        List<LineageReference> dangling = new ArrayList<>();
        List<LineageReference> external = new ArrayList<>();

        for (DecisionRecord record : nodes.values()) {
            String id = record.decisionId();
            List<String> resolved = new ArrayList<>();
            for (String parent : new LinkedHashSet<>(record.lineage())) {
                if (nodes.containsKey(parent)) {
                    resolved.add(parent);
                    children.computeIfAbsent(parent, p -> new ArrayList<>()).add(id);
                } else if (conflicted.contains(parent)) {
                    // reported once as a structural conflict, not again per child
                    continue;
                } else if (scope == LineageScope.GLOBAL && externalIds.contains(parent)) {
                    external.add(new LineageReference(id, parent));
                } else {
                    dangling.add(new LineageReference(id, parent));
                }
            }
            parents.put(id, List.copyOf(resolved));
        }

        Map<String, List<String>> sortedChildren = new TreeMap<>();
        children.forEach((parent, ids) -> sortedChildren.put(parent, ids.stream()
            .map(nodes::get)
            .sorted(TIMELINE)
            .map(DecisionRecord::decisionId)
            .toList()));

        return new LineageGraph(scope, nodes, parents, sortedChildren,
            dangling, external, duplicates, conflicts);
    }

    public LineageScope scope() {
        return scope;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String decisionId) {
        return nodes.containsKey(decisionId);
    }

    public Optional<DecisionRecord> record(String decisionId) {
        return Optional.ofNullable(nodes.get(decisionId));
    }

    /** Graph nodes ordered by decision_id. */
    public Collection<DecisionRecord> records() {
        return nodes.values();
    }

    /** Parents that resolve to nodes of this graph, in declared order. */
    public List<String> parentsOf(String decisionId) {
        return parents.getOrDefault(decisionId, List.of());
    }

    /** Nodes that list the decision as a parent, in timeline order. */
    public List<String> childrenOf(String decisionId) {
        return children.getOrDefault(decisionId, List.of());
    }

    /** Every node reachable through parent edges, excluding the decision itself. */
    public Set<String> ancestorsOf(String decisionId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(parentsOf(decisionId));
        while (!pending.isEmpty()) {
            String next = pending.poll();
            if (next.equals(decisionId) || !seen.add(next)) {
                continue;
            }
            pending.addAll(parentsOf(next));
        }
        return Collections.unmodifiableSet(seen);
    }

    public boolean isAcyclic() {
        return cycles.isEmpty();
    }

    /**
     * Groups of decisions that reach themselves through their lineage. Each group
     * is sorted by decision_id; a self-citing record forms a group of one.
     */
    public List<List<String>> cycles() {
        return cycles;
    }

    /**
     * Records ordered so that every parent precedes its children; ties broken by
     * timestamp, then decision_id.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public List<DecisionRecord> topologicalOrder() {
        if (!isAcyclic()) {
            throw new IllegalStateException("lineage graph contains a cycle: " + cycles);
        }
        Map<String, Integer> pendingParents = new HashMap<>();
        PriorityQueue<DecisionRecord> ready = new PriorityQueue<>(TIMELINE);
        for (DecisionRecord record : nodes.values()) {
            int count = parentsOf(record.decisionId()).size();
            pendingParents.put(record.decisionId(), count);
            if (count == 0) {
                ready.add(record);
            }
        }

        List<DecisionRecord> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            DecisionRecord next = ready.poll();
            order.add(next);
            for (String child : childrenOf(next.decisionId())) {
                if (pendingParents.merge(child, -1, Integer::sum) == 0) {
                    ready.add(nodes.get(child));
                }
            }
        }
        return Collections.unmodifiableList(order);
    }

    /** Lineage entries that resolve to nothing, ordered by child id. */
    public List<LineageReference> danglingReferences() {
        return dangling;
    }

    /** Lineage entries resolved against the external corpus (global scope only). */
    public List<LineageReference> externalReferences() {
        return external;
    }

    /** decision_id to number of identical copies, for ids seen more than once. */
    public Map<String, Integer> duplicates() {
        return duplicates;
    }

    public List<StructuralConflict> structuralConflicts() {
        return conflicts;
    }

    /**
     * Strongly connected components over parent edges (iterative Tarjan, so deep
     * chains do not exhaust the stack).
     */
    private List<List<String>> findCycles() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> found = new ArrayList<>();
        int counter = 0;

        for (String root : nodes.keySet()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            work.push(new Frame(root, parentsOf(root).iterator()));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, parentsOf(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    if (component.size() > 1 || parentsOf(frame.node).contains(frame.node)) {
                        Collections.sort(component);
                        found.add(List.copyOf(component));
                    }
                }
                if (!work.isEmpty()) {
                    String caller = work.peek().node;
                    lowLink.put(caller, Math.min(lowLink.get(caller), lowLink.get(frame.node)));
                }
            }
        }

        found.sort(Comparator.comparing(component -> component.get(0)));
        return List.copyOf(found);
    }

    private static List<String> differingFields(DecisionRecord first, DecisionRecord second) {
        List<String> fields = new ArrayList<>();
        compare(fields, DecisionRecord.DECISION_TYPE, first.decisionType(), second.decisionType());
        compare(fields, DecisionRecord.TIMESTAMP, first.timestamp(), second.timestamp());
        compare(fields, DecisionRecord.TENANT_ID, first.tenantId(), second.tenantId());
        compare(fields, DecisionRecord.ENVIRONMENT, first.environment(), second.environment());
        compare(fields, DecisionRecord.CONTEXT, first.context(), second.context());
        compare(fields, DecisionRecord.ACTOR, first.actor(), second.actor());
        compare(fields, DecisionRecord.LOGIC, first.logic(), second.logic());
        compare(fields, DecisionRecord.OUTCOME, first.outcome(), second.outcome());
        compare(fields, DecisionRecord.CONFIDENCE, first.confidence(), second.confidence());
        compare(fields, DecisionRecord.LINEAGE, first.lineage(), second.lineage());
        return fields;
    }

    private static void compare(List<String> fields, String name, Object first, Object second) {
        if (!Objects.equals(first, second)) {
            fields.add(name);
        }
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> successors;

        private Frame(String node, Iterator<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
