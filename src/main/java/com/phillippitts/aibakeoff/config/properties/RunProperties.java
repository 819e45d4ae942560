package com.phillippitts.aibakeoff.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Controls how the driver runs the scenarios.
 *
 * <ul>
 *   <li>bakeoff.run.enabled - run the bakeoff at startup (default: true)</li>
 *   <li>bakeoff.run.parallel-scenarios - run translation, TTS and pipeline scenarios at the
 *       same time instead of one after another (default: false)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "bakeoff.run")
public class RunProperties {

    private final boolean enabled;
    private final boolean parallelScenarios;

    @ConstructorBinding
    public RunProperties(Boolean enabled, Boolean parallelScenarios) {
        this.enabled = enabled == null || enabled;
        this.parallelScenarios = parallelScenarios != null && parallelScenarios;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isParallelScenarios() {
        return parallelScenarios;
    }
}
