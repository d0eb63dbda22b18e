package com.myorg.specdiff.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Diff settings ({@code specdiff.*}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "specdiff")
public class DiffProperties {

    private Set<String> ignoredKinds = new LinkedHashSet<>(DiffOptions.DEFAULT_IGNORED_KINDS);

    private Set<String> ignoredAttributes = new LinkedHashSet<>(DiffOptions.DEFAULT_IGNORED_ATTRIBUTES);

    private int keyComponentsToSkip = 1;

    private boolean hideUnchanged = true;

    private Map<String, String> referenceDirectives = new LinkedHashMap<>(DiffOptions.DEFAULT_REFERENCE_DIRECTIVES);

    public DiffOptions toOptions() {
        if (keyComponentsToSkip < 0) {
            throw new IllegalStateException("specdiff.key-components-to-skip must not be negative");
        }
        return DiffOptions.builder()
                .ignoredKinds(Set.copyOf(ignoredKinds))
                .ignoredAttributes(Set.copyOf(ignoredAttributes))
                .keyComponentsToSkip(keyComponentsToSkip)
                .hideUnchanged(hideUnchanged)
                .referenceDirectives(Map.copyOf(referenceDirectives))
                .build();
    }
}
