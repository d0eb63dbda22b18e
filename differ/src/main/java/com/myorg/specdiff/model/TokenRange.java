package com.myorg.specdiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Half-open range {@code [start, end)} of token offsets into a content body.
 */
@Getter
@EqualsAndHashCode
public final class TokenRange {

    @JsonProperty("start")
    private final int start;

    @JsonProperty("end")
    private final int end;

    public TokenRange(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid token range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static TokenRange of(int start, int end) {
        return new TokenRange(start, end);
    }

    public int length() {
        return end - start;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public String toString() {
        return "[" + start + ":" + end + "]";
    }
}
