package org.neuralchilli.symdag.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class EngineConfigTest {

    @Inject
    EngineConfig config;

    @Test
    void shouldReadTestProfileLimits() {
        assertThat(config.maxDepth()).isEqualTo(16);
        assertThat(config.rational().epsilon()).isEqualTo(1e-6);
        assertThat(config.rational().maxDenominator()).isEqualTo(1000L);
    }
}
