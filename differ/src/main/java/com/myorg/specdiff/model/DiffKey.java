package com.myorg.specdiff.model;

import java.util.Comparator;

/**
 * Summary bucket of the diff counts.
 */
public record DiffKey(Entity entity, Operation operation) {

    public static final Comparator<DiffKey> BY_NAME = Comparator
            .comparing((DiffKey k) -> k.entity().name())
            .thenComparing(k -> k.operation().name());

    public static DiffKey of(DiffRecord record) {
        return new DiffKey(record.getEntity(), record.getOperation());
    }

    /** e.g. {@code attribute_changed} */
    public String label() {
        return entity.name().toLowerCase() + "_" + operation.name().toLowerCase();
    }
}
