package com.myorg.specdiff.model;

/**
 * What part of a node a {@link DiffRecord} refers to.
 */
public enum Entity {
    ATTRIBUTE,
    ELEMENT,
    CONTENT
}
