package org.neuralchilli.symdag.config;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.symdag.core.ExpressionDepthException;
import org.neuralchilli.symdag.service.ExpressionService;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Overrides the engine limits through a test profile and checks the service picks them up.
 */
@QuarkusTest
@TestProfile(EngineConfigOverrideTest.TightLimitsProfile.class)
class EngineConfigOverrideTest {

    @Inject
    EngineConfig config;

    @Inject
    ExpressionService service;

    @Test
    void shouldApplyOverriddenLimits() {
        assertThat(config.maxDepth()).isEqualTo(2);
        assertThat(config.rational().maxDenominator()).isEqualTo(10L);
    }

    @Test
    void shouldRejectNestingBeyondOverriddenDepth() {
        assertThat(service.evaluate("-x", Map.of("x", 1.0))).isEqualTo(-1.0);

        assertThatThrownBy(() -> service.parse("-(-x)"))
                .isInstanceOf(ExpressionDepthException.class);
    }

    @Test
    void shouldApproximateWithinOverriddenDenominator() {
        assertThat(service.toRational(Math.PI).denominator()).isLessThanOrEqualTo(10L);
    }

    public static class TightLimitsProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            // Profiled keys in application.properties win over plain ones
            return Map.of(
                    "%test.symdag.max-depth", "2",
                    "%test.symdag.rational.max-denominator", "10"
            );
        }
    }
}
