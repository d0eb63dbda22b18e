package com.myorg.specdiff.service.processing;

import com.myorg.specdiff.model.DiffMap;
import com.myorg.specdiff.model.DiffRecord;
import com.myorg.specdiff.model.Entity;
import com.myorg.specdiff.model.Node;
import com.myorg.specdiff.model.Operation;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Set difference over the attributes of a matched node pair.
 * <p>
 * Records are emitted changed first, then removed (both in old declaration order), then added (new
 * declaration order). Synthesized change phrases depend on this order.
 */
public final class AttributeDiffer {

    private AttributeDiffer() {}

    public static void diff(Node oldNode, Node newNode, Set<String> ignored, DiffMap diffs) {
        Map<String, String> oldAttrs = oldNode.getAttributes();
        Map<String, String> newAttrs = newNode.getAttributes();

        // 1) changed
        for (Map.Entry<String, String> e : oldAttrs.entrySet()) {
            String name = e.getKey();
            if (ignored.contains(name) || !newAttrs.containsKey(name)) continue;
            String newValue = newAttrs.get(name);
            if (!Objects.equals(e.getValue(), newValue)) {
                diffs.append(record(oldNode, newNode, Operation.CHANGED, name, e.getValue(), newValue));
            }
        }

        // 2) removed
        for (Map.Entry<String, String> e : oldAttrs.entrySet()) {
            if (ignored.contains(e.getKey()) || newAttrs.containsKey(e.getKey())) continue;
            diffs.append(record(oldNode, newNode, Operation.REMOVED, e.getKey(), e.getValue(), null));
        }

        // 3) added
        for (Map.Entry<String, String> e : newAttrs.entrySet()) {
            if (ignored.contains(e.getKey()) || oldAttrs.containsKey(e.getKey())) continue;
            diffs.append(record(oldNode, newNode, Operation.ADDED, e.getKey(), e.getValue(), null));
        }
    }

    private static DiffRecord record(Node oldNode, Node newNode, Operation op, String name,
                                     String value, String value2) {
        return DiffRecord.builder()
                .oldNode(oldNode)
                .newNode(newNode)
                .entity(Entity.ATTRIBUTE)
                .operation(op)
                .name(name)
                .value(value)
                .value2(value2)
                .build();
    }
}
