package com.myorg.specdiff.model;

public enum Operation {
    ADDED,
    REMOVED,
    CHANGED
}
