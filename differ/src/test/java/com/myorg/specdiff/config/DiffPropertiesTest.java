package com.myorg.specdiff.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {"specdiff.key-components-to-skip=2", "storage.base-path=build/test-output"})
class DiffPropertiesTest {

    @Autowired
    private DiffProperties diffProperties;

    @Autowired
    private StorageProperties storageProperties;

    @Test
    void bindsTheApplicationDefaultsAndOverrides() {
        DiffOptions options = diffProperties.toOptions();

        assertThat(options.getIgnoredKinds()).containsExactlyInAnyOrder("componentRef", "profile");
        assertThat(options.getIgnoredAttributes()).contains("dmr_version", "version").hasSize(11);
        assertThat(options.getReferenceDirectives()).containsEntry("parameter", "param");
        assertThat(options.getKeyComponentsToSkip()).isEqualTo(2);
        assertThat(options.isHideUnchanged()).isTrue();
        assertThat(options.getMatchStrategies()).hasSize(1);
        assertThat(storageProperties.getBasePath()).isEqualTo("build/test-output");
    }

    @Test
    void negativeKeySkipIsRejected() {
        DiffProperties props = new DiffProperties();
        props.setKeyComponentsToSkip(-1);

        assertThatThrownBy(props::toOptions).isInstanceOf(IllegalStateException.class);
    }
}
