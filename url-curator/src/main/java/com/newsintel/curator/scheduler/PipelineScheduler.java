package com.newsintel.curator.scheduler;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.discovery.PatternDiscoveryService;
import com.newsintel.curator.input.UrlStore;
import com.newsintel.curator.pipeline.PipelineExecutionStore;
import com.newsintel.curator.pipeline.PipelineRunner;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Set;

/**
 * Manages scheduled pipeline runs, rule discovery and housekeeping.
 *
 * Default schedule: pipeline daily at 06:00 UTC, discovery Sundays at 03:00 UTC.
 * The driving loop retries pending executions the gate has not admitted yet; the
 * reaper fails stages whose heartbeat stopped so their executions can be resumed.
 * Pipeline runs are handed to the runner's driver threads so a long run never holds
 * up the other jobs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final PipelineRunner runner;
    private final PipelineExecutionStore executionStore;
    private final UrlStore urlStore;
    private final PatternDiscoveryService discoveryService;
    private final CurationProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally submit today's run if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            executionStore.ensureSchema();
            urlStore.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise pipeline schema: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, submitting today's run");
            try {
                runner.submit(properties.getPipeline().getName(), LocalDate.now(ZoneOffset.UTC));
            } catch (Exception e) {
                log.error("Startup run failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Curator ready. Next scheduled run: {}", properties.getScheduling().getPipelineCron());
        }
    }

    @Scheduled(cron = "${curation.scheduling.pipeline-cron:0 0 6 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        try {
            runner.submitInBackground(properties.getPipeline().getName(), LocalDate.now(ZoneOffset.UTC));
        } catch (Exception e) {
            log.error("Scheduled pipeline run failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${curation.scheduling.discovery-cron:0 0 3 * * SUN}", zone = "UTC")
    public void scheduledDiscovery() {
        log.info("Scheduled pattern discovery triggered");
        try {
            discoveryService.discoverAndMerge(Set.of());
        } catch (Exception e) {
            log.error("Scheduled discovery failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${curation.scheduling.drive-interval-ms:60000}")
    public void drivePending() {
        try {
            runner.runPending();
        } catch (Exception e) {
            log.error("Driving loop failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${curation.scheduling.reaper-interval-ms:120000}")
    public void reapAbandonedStages() {
        try {
            LocalDateTime cutoff = LocalDateTime.now().minus(properties.getPipeline().getLivenessThreshold());
            int reaped = executionStore.failAbandonedStages(cutoff);
            int stalled = executionStore.failStalledExecutions(cutoff);
            if (reaped > 0 || stalled > 0) {
                log.warn("Reaped {} abandoned stages and {} stalled executions", reaped, stalled);
            }
        } catch (Exception e) {
            log.error("Abandoned-stage reaper failed: {}", e.getMessage(), e);
        }
    }
}
