package com.myorg.specdiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * One token of a content body: literal text or a directive marker.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Segment {

    public static final Segment ARGSEP = new Segment(SegmentType.ARGSEP, null, null, List.of(), List.of(), false);

    @JsonProperty("type")
    private final SegmentType type;

    /** Directive name; null for TEXT and ARGSEP. */
    @JsonProperty("name")
    private final String name;

    /** Literal text; only set for TEXT. */
    @JsonProperty("text")
    private final String text;

    /** Already rendered arguments of a CALL. */
    @JsonProperty("arguments")
    private final List<String> arguments;

    /**
     * New-tree tokens that a synthesized annotation call stands in for.
     * Never rendered.
     */
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    private final List<Segment> retained;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    private final boolean synthesized;

    public static Segment text(String text) {
        return new Segment(SegmentType.TEXT, null, Objects.requireNonNull(text, "text"), List.of(), List.of(), false);
    }

    public static Segment open(String name) {
        return new Segment(SegmentType.OPEN, requireName(name), null, List.of(), List.of(), false);
    }

    public static Segment close(String name) {
        return new Segment(SegmentType.CLOSE, requireName(name), null, List.of(), List.of(), false);
    }

    public static Segment call(String name) {
        return new Segment(SegmentType.CALL, requireName(name), null, List.of(), List.of(), false);
    }

    public static Segment call(String name, List<String> arguments) {
        return new Segment(SegmentType.CALL, requireName(name), null, List.copyOf(arguments), List.of(), false);
    }

    /**
     * Synthesized change directive; {@code retained} are the new-tree tokens it replaces.
     */
    public static Segment annotation(String name, List<String> arguments, List<Segment> retained) {
        return new Segment(SegmentType.CALL, requireName(name), null, List.copyOf(arguments), List.copyOf(retained), true);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("directive name must not be blank");
        }
        return name;
    }

    @JsonIgnore
    public boolean isText() {
        return type == SegmentType.TEXT;
    }

    /** Empty or pure whitespace literal text. */
    @JsonIgnore
    public boolean isWhitespace() {
        return type == SegmentType.TEXT && text.isBlank();
    }

    /** True for change directives spliced in by the synthesizer. */
    @JsonIgnore
    public boolean isAnnotation() {
        return synthesized;
    }

    /** Directive source text of this token. */
    public String render() {
        switch (type) {
            case TEXT:
                return text;
            case OPEN:
                return "{{" + name + "|";
            case ARGSEP:
                return "|";
            case CLOSE:
                return "}}";
            case CALL:
                if (arguments.isEmpty()) {
                    return "{{" + name + "}}";
                }
                return "{{" + name + "|" + String.join("|", arguments) + "}}";
            default:
                throw new IllegalStateException("unknown segment type " + type);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
                return "'" + text + "'";
            case ARGSEP:
                return "argsep(|)";
            default:
                return type.name().toLowerCase() + "(" + name + ")";
        }
    }
}
