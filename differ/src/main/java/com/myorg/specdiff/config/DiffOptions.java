package com.myorg.specdiff.config;

import com.myorg.specdiff.service.matching.MatchStrategy;
import com.myorg.specdiff.service.matching.LabelMatchStrategy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable settings handed explicitly to the differ and the synthesizer.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class DiffOptions {

    public static final Set<String> DEFAULT_IGNORED_KINDS = Set.of("componentRef", "profile");

    public static final Set<String> DEFAULT_IGNORED_ATTRIBUTES = Set.of(
            "action", "activeNotify", "dmr_previousParameter", "dmr_previousObject",
            "dmr_previousCommand", "dmr_previousEvent", "dmr_previousProfile", "dmr_version",
            "functional", "targetParent", "version");

    public static final Map<String, String> DEFAULT_REFERENCE_DIRECTIVES = Map.of(
            "object", "object",
            "parameter", "param",
            "command", "command",
            "event", "event",
            "profile", "profile");

    /** Child kinds that are neither matched nor reported. */
    @Builder.Default
    private final Set<String> ignoredKinds = DEFAULT_IGNORED_KINDS;

    /** Attribute names with no semantic weight. */
    @Builder.Default
    private final Set<String> ignoredAttributes = DEFAULT_IGNORED_ATTRIBUTES;

    /**
     * Leading identity-key components dropped before keys are compared (the first one names the
     * source file the item was defined in).
     */
    @Builder.Default
    private final int keyComponentsToSkip = 1;

    /** Hide the whole new tree before annotating, so that only changed regions show. */
    @Builder.Default
    private final boolean hideUnchanged = true;

    /** Node kind to the directive that references an item of that kind. */
    @Builder.Default
    private final Map<String, String> referenceDirectives = DEFAULT_REFERENCE_DIRECTIVES;

    /** Tie-breakers tried in order when more than one candidate corresponds to an old child. */
    @Builder.Default
    private final List<MatchStrategy> matchStrategies = List.of(new LabelMatchStrategy());

    public static DiffOptions defaults() {
        return DiffOptions.builder().build();
    }
}
