package com.myorg.specdiff.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything one comparison produced: the diff map, the per-(entity, operation) counts and the
 * correspondences that could not be resolved.
 */
@Getter
public class DiffResult {

    private final Node oldRoot;
    private final Node newRoot;
    private final DiffMap diffMap;
    private final List<String> unresolved;

    public DiffResult(Node oldRoot, Node newRoot, DiffMap diffMap, List<String> unresolved) {
        this.oldRoot = oldRoot;
        this.newRoot = newRoot;
        this.diffMap = diffMap;
        this.unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }

    public Map<DiffKey, Integer> getCounts() {
        Map<DiffKey, Integer> counts = new TreeMap<>(DiffKey.BY_NAME);
        for (DiffRecord r : diffMap.records()) {
            counts.merge(DiffKey.of(r), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    public int getUnresolvedCount() {
        return unresolved.size();
    }

    /** Callers should treat an incomplete comparison as failed even though a diff was produced. */
    public boolean isComplete() {
        return unresolved.isEmpty();
    }

    public List<DiffRecordEntry> toEntries() {
        List<DiffRecordEntry> entries = new ArrayList<>(diffMap.size());
        diffMap.entries().forEach(e -> e.getValue().forEach(r -> entries.add(DiffRecordEntry.from(e.getKey(), r))));
        return entries;
    }

    public DiffSummary toSummary() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        getCounts().forEach((k, v) -> counts.put(k.label(), v));
        List<String> changed = new ArrayList<>();
        diffMap.modelItems().forEach(n -> changed.add(n.getPath()));
        return DiffSummary.builder()
                .oldRoot(oldRoot.getPath())
                .newRoot(newRoot.getPath())
                .recordCount(diffMap.size())
                .modelItemCount(diffMap.modelItems().size())
                .unresolvedCount(unresolved.size())
                .complete(isComplete())
                .counts(counts)
                .changedItems(changed)
                .unresolved(unresolved)
                .build();
    }
}
