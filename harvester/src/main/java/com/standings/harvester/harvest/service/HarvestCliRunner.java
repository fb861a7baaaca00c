package com.standings.harvester.harvest.service;

import com.standings.harvester.config.HarvesterProperties;
import com.standings.harvester.harvest.model.HarvestRequest;
import com.standings.harvester.harvest.model.RunStatus;
import com.standings.harvester.harvest.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(60);

    private final HarvesterProperties properties;
    private final HarvestOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        // Ctrl+C: cancel outstanding pages but let the run write its failure report first.
        Thread interruptHook = new Thread(this::cancelOnShutdown, "harvest-shutdown");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        RunSummary summary;
        try {
            summary = orchestratorService.run(HarvestRequest.defaults());
        } finally {
            removeHook(interruptHook);
        }
        log.info(
            "Harvest finished with status {}: pages={}, succeeded={}, failed={}, cancelled={}",
            summary.status(),
            summary.totalPages(),
            summary.succeeded(),
            summary.failed(),
            summary.cancelled()
        );

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode(summary);
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }

    static int exitCode(RunSummary summary) {
        return summary.status() == RunStatus.CANCELLED ? 1 : 0;
    }

    void cancelOnShutdown() {
        if (!orchestratorService.cancel()) {
            return;
        }
        log.error("Harvest interrupted by operator.");
        try {
            if (!orchestratorService.awaitIdle(SHUTDOWN_WAIT)) {
                log.warn("Harvest did not finish within {}s of the interrupt", SHUTDOWN_WAIT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown already in progress; keeping the interrupt hook");
        }
    }
}
