package com.newsintel.curator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.ExecutionStatus;
import com.newsintel.curator.model.PipelineExecution;
import com.newsintel.curator.model.StageRun;
import com.newsintel.curator.model.StageStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives executions through their stages.
 *
 * Flow for one execution:
 *  1. Admit a pending execution through the gate (or reopen a failed one, which
 *     resets its unfinished stages in the same step)
 *  2. Start it through the gate; if the ceiling is reached it stays pending
 *     and the driving loop retries later
 *  3. Run stages from last_successful_stage + 1, each on a worker thread with a
 *     timeout and a heartbeat ticker
 *  4. Stop at the first failed stage and close the execution
 */
@Component
@Slf4j
public class PipelineRunner {

    public enum Outcome {
        STARTED, QUEUED, REJECTED
    }

    /**
     * @param status final status when the run finished in this call, pending when queued
     */
    public record RunResult(Outcome outcome, Long executionId, ExecutionStatus status) {

        static RunResult rejected() {
            return new RunResult(Outcome.REJECTED, null, null);
        }
    }

    static final String CANCELLED = "cancelled";

    private final PipelineExecutionStore store;
    private final ConcurrencyGate gate;
    private final StageRegistry stageRegistry;
    private final CurationProperties properties;
    private final ObjectMapper objectMapper;

    private final ExecutorService stageWorkers = Executors.newCachedThreadPool(
            new CustomizableThreadFactory("pipeline-stage-"));
    private final ExecutorService drivers = Executors.newCachedThreadPool(
            new CustomizableThreadFactory("pipeline-driver-"));
    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(
            new CustomizableThreadFactory("stage-heartbeat-"));

    private final Map<Long, Future<?>> runningStages = new ConcurrentHashMap<>();

    public PipelineRunner(PipelineExecutionStore store,
                          ConcurrencyGate gate,
                          StageRegistry stageRegistry,
                          CurationProperties properties,
                          ObjectMapper objectMapper) {
        this.store = store;
        this.gate = gate;
        this.stageRegistry = stageRegistry;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // ── Entry points ─────────────────────────────────────────────────────────

    /**
     * Plans, admits and, if the gate allows, runs a new execution in the calling thread.
     */
    public RunResult submit(String pipelineName, LocalDate runDate) {
        StagePlan plan = StagePlan.fromProperties(properties.getPipeline(), pipelineName, runDate);
        Optional<PipelineExecution> admitted = gate.admit(pipelineName, runDate, plan.toSnapshot(objectMapper));
        if (admitted.isEmpty()) {
            return RunResult.rejected();
        }
        return startAndRun(admitted.get().getId());
    }

    /**
     * Same as {@link #submit} but runs on a driver thread, so the caller is not held for
     * the length of the run.
     */
    public Future<RunResult> submitInBackground(String pipelineName, LocalDate runDate) {
        return drivers.submit(() -> {
            try {
                RunResult result = submit(pipelineName, runDate);
                log.info("Run of {} for {}: {} execution {} ({})", pipelineName, runDate,
                        result.outcome(), result.executionId(), result.status());
                return result;
            } catch (RuntimeException e) {
                log.error("Run of {} for {} failed: {}", pipelineName, runDate, e.getMessage(), e);
                throw e;
            }
        });
    }

    /**
     * Starts pending executions, oldest first, as far as the gate allows. Each started
     * execution runs on its own driver thread.
     *
     * @return executions started
     */
    public int runPending() {
        int started = 0;
        for (PipelineExecution pending : store.findPendingExecutions()) {
            if (!gate.tryStart(pending.getId())) {
                continue;
            }
            started++;
            long id = pending.getId();
            drivers.submit(() -> runStagesSafely(id));
        }
        if (started > 0) {
            log.info("Driving loop started {} pending executions", started);
        }
        return started;
    }

    /**
     * Resumes a failed or partial execution from the stage after its last successful one.
     *
     * @param executionId execution to resume, or null for the most recent failed or partial one
     * @throws IllegalArgumentException if there is nothing resumable
     */
    public RunResult resume(Long executionId) {
        PipelineExecution execution = executionId != null
                ? store.findExecution(executionId)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown execution " + executionId))
                : store.getLastFailedExecution(null)
                        .orElseThrow(() -> new IllegalArgumentException("No failed or partial execution to resume"));

        if (!ExecutionStatus.RESUMABLE.contains(execution.getStatus())) {
            throw new IllegalArgumentException("Execution " + execution.getId() + " is "
                    + execution.getStatus().dbValue() + ", only failed or partial executions can be resumed");
        }
        if (!gate.reopen(execution.getId())) {
            log.info("Resume of execution {} refused by the gate", execution.getId());
            return RunResult.rejected();
        }

        log.info("Resuming execution {} from stage {}", execution.getId(),
                nextStage(execution.getLastSuccessfulStage()));
        return startAndRun(execution.getId());
    }

    /**
     * Runs a new execution with the config snapshot of an earlier one.
     */
    public RunResult replay(long executionId) {
        PipelineExecution original = store.findExecution(executionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown execution " + executionId));
        Optional<PipelineExecution> admitted = gate.admit(original.getPipelineName(), original.getRunDate(),
                original.getConfigSnapshot());
        if (admitted.isEmpty()) {
            return RunResult.rejected();
        }
        log.info("Replaying execution {} as {}", executionId, admitted.get().getId());
        return startAndRun(admitted.get().getId());
    }

    /**
     * Interrupts the stage currently running for an execution.
     *
     * @return false if no stage of that execution is running in this process
     */
    public boolean cancel(long executionId) {
        Future<?> running = runningStages.get(executionId);
        if (running == null) {
            return false;
        }
        log.info("Cancelling running stage of execution {}", executionId);
        return running.cancel(true);
    }

    // ── Stage loop ───────────────────────────────────────────────────────────

    private RunResult startAndRun(long executionId) {
        if (!gate.tryStart(executionId)) {
            log.info("Execution {} queued, running ceiling reached", executionId);
            return new RunResult(Outcome.QUEUED, executionId, ExecutionStatus.PENDING);
        }
        return new RunResult(Outcome.STARTED, executionId, runStagesSafely(executionId));
    }

    private ExecutionStatus runStagesSafely(long executionId) {
        try {
            return runStages(executionId);
        } catch (IllegalStageTransitionException | IllegalStateException e) {
            // Another writer (the reaper, usually) closed this execution under us
            log.error("Execution {} lost ownership: {}", executionId, e.getMessage());
            return store.findExecution(executionId).map(PipelineExecution::getStatus).orElse(null);
        }
    }

    ExecutionStatus runStages(long executionId) {
        PipelineExecution execution = store.findExecution(executionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown execution " + executionId));
        Integer lastSuccessful = execution.getLastSuccessfulStage();

        StagePlan plan;
        try {
            plan = StagePlan.fromSnapshot(execution.getConfigSnapshot(), objectMapper);
        } catch (IllegalStateException e) {
            log.error("Execution {} has an unusable config snapshot: {}", executionId, e.getMessage());
            ExecutionStatus status = lastSuccessful == null ? ExecutionStatus.FAILED : ExecutionStatus.PARTIAL;
            store.completeExecution(executionId, status, lastSuccessful);
            return status;
        }

        int fromStage = nextStage(lastSuccessful);
        log.info("=== Execution {} ({} for {}): stages {}..{} ===",
                executionId, execution.getPipelineName(), execution.getRunDate(), fromStage, plan.size());

        for (StagePlan.PlannedStage planned : plan.stages()) {
            if (planned.number() < fromStage) {
                continue;
            }
            StageRun run = store.findLatestStage(executionId, planned.number())
                    .filter(r -> r.getStatus() == StageStatus.PENDING)
                    .orElseGet(() -> store.createStage(executionId, planned.number(), planned.name()));

            String error = executeStage(execution, planned, run);
            if (error != null) {
                ExecutionStatus status = lastSuccessful == null ? ExecutionStatus.FAILED : ExecutionStatus.PARTIAL;
                log.error("Stage {} ({}) of execution {} failed: {}", planned.number(), planned.name(),
                        executionId, error);
                store.completeExecution(executionId, status, lastSuccessful);
                return status;
            }
            lastSuccessful = planned.number();
            store.recordStageSuccess(executionId, lastSuccessful);
        }

        store.completeExecution(executionId, ExecutionStatus.COMPLETED, lastSuccessful);
        return ExecutionStatus.COMPLETED;
    }

    /**
     * @return null on success, otherwise the failure reason recorded on the stage run
     */
    private String executeStage(PipelineExecution execution, StagePlan.PlannedStage planned, StageRun run) {
        PipelineStage stage;
        try {
            stage = stageRegistry.resolve(planned);
        } catch (IllegalArgumentException e) {
            store.transitionStage(run.getId(), StageStatus.FAILED, e.getMessage(), null);
            return e.getMessage();
        }

        store.transitionStage(run.getId(), StageStatus.RUNNING, null, null);
        log.info("Stage {} ({}) of execution {} running", planned.number(), planned.name(), execution.getId());

        StageContext context = new StageContext(execution.getId(), execution.getPipelineName(),
                execution.getRunDate(), planned.number(), planned);
        Future<Map<String, Object>> future = stageWorkers.submit(() -> stage.execute(context));
        runningStages.put(execution.getId(), future);

        long intervalMs = Math.max(1, properties.getPipeline().getHeartbeatInterval().toMillis());
        ScheduledFuture<?> ticker = heartbeats.scheduleAtFixedRate(
                () -> beat(run.getId()), intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        Duration timeout = planned.timeout();
        try {
            Map<String, Object> metrics = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            store.transitionStage(run.getId(), StageStatus.COMPLETED, null, toJson(metrics));
            log.info("Stage {} ({}) of execution {} completed", planned.number(), planned.name(), execution.getId());
            return null;

        } catch (TimeoutException e) {
            future.cancel(true);
            return fail(run, "timed out after " + timeout);
        } catch (CancellationException e) {
            return fail(run, CANCELLED);
        } catch (ExecutionException e) {
            return fail(run, describe(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fail(run, CANCELLED + ": runner interrupted");
        } finally {
            ticker.cancel(false);
            runningStages.remove(execution.getId());
        }
    }

    private String fail(StageRun run, String reason) {
        store.transitionStage(run.getId(), StageStatus.FAILED, reason, null);
        return reason;
    }

    private void beat(long stageRunId) {
        try {
            store.heartbeat(stageRunId);
        } catch (RuntimeException e) {
            log.warn("Heartbeat for stage run {} failed: {}", stageRunId, e.getMessage());
        }
    }

    private String toJson(Map<String, Object> metrics) {
        if (metrics == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize stage metrics: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private static int nextStage(Integer lastSuccessful) {
        return lastSuccessful == null ? 1 : lastSuccessful + 1;
    }

    @PreDestroy
    public void shutdown() {
        heartbeats.shutdownNow();
        stageWorkers.shutdownNow();
        drivers.shutdownNow();
    }
}
