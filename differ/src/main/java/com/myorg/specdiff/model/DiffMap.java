package com.myorg.specdiff.model;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diff records grouped by owning model item, in discovery order.
 */
@Slf4j
public class DiffMap {

    // Node equality is identity, so this is keyed by node instance
    private final Map<Node, List<DiffRecord>> byModelItem = new LinkedHashMap<>();

    /**
     * Appends a record under the model item owning its new node. Identical records are kept.
     */
    public void append(DiffRecord record) {
        Node owner = record.getNewNode().getModelItem();
        byModelItem.computeIfAbsent(owner, k -> new ArrayList<>()).add(record);
        log.trace("{} <- {}", owner.getPath(), record);
    }

    public Set<Node> modelItems() {
        return Collections.unmodifiableSet(byModelItem.keySet());
    }

    public List<DiffRecord> get(Node modelItem) {
        List<DiffRecord> records = byModelItem.get(modelItem);
        return records == null ? List.of() : Collections.unmodifiableList(records);
    }

    public Set<Map.Entry<Node, List<DiffRecord>>> entries() {
        return Collections.unmodifiableMap(byModelItem).entrySet();
    }

    /** All records, model item by model item. */
    public List<DiffRecord> records() {
        List<DiffRecord> all = new ArrayList<>();
        byModelItem.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return byModelItem.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return byModelItem.isEmpty();
    }
}
