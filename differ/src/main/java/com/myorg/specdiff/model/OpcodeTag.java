package com.myorg.specdiff.model;

import lombok.Getter;

/**
 * Sequence alignment instruction kinds.
 */
@Getter
public enum OpcodeTag {
    EQUAL("equal"),
    REPLACE("replace"),
    DELETE("delete"),
    INSERT("insert");

    private final String label;

    OpcodeTag(String label) {
        this.label = label;
    }
}
