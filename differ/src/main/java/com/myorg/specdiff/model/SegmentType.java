package com.myorg.specdiff.model;

/**
 * Token kinds of a content body.
 * OPEN renders as {@code {{name|}}, ARGSEP as {@code |}, CLOSE as {@code }}}
 * and CALL as {@code {{name}}} or {@code {{name|arg|...}}}.
 */
public enum SegmentType {
    TEXT,
    OPEN,
    ARGSEP,
    CLOSE,
    CALL
}
