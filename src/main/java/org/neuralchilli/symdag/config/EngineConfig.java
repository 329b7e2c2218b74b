package org.neuralchilli.symdag.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Engine limits, read from the "symdag" configuration prefix.
 */
@ConfigMapping(prefix = "symdag")
public interface EngineConfig {

    /**
     * Deepest operator nesting accepted when building a graph
     */
    @WithName("max-depth")
    @WithDefault("512")
    int maxDepth();

    @WithName("rational")
    RationalApproximation rational();

    /**
     * Bounds for the Stern-Brocot approximation of doubles
     */
    interface RationalApproximation {

        @WithName("epsilon")
        @WithDefault("1e-10")
        double epsilon();

        @WithName("max-denominator")
        @WithDefault("1000000")
        long maxDenominator();
    }
}
