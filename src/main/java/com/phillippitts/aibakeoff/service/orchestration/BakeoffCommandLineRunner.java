package com.phillippitts.aibakeoff.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the bakeoff once the application context is ready.
 *
 * <p>Disabled with {@code bakeoff.run.enabled=false}, which tests use to load the context
 * without calling any provider. A failing run propagates and fails startup.
 */
@Component
@ConditionalOnProperty(prefix = "bakeoff.run", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BakeoffCommandLineRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(BakeoffCommandLineRunner.class);

    private final BakeoffOrchestrator orchestrator;

    public BakeoffCommandLineRunner(BakeoffOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOG.debug("Starting bakeoff run");
        orchestrator.run();
    }
}
