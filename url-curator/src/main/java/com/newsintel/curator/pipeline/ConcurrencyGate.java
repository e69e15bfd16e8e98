package com.newsintel.curator.pipeline;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.ExecutionStatus;
import com.newsintel.curator.model.PipelineExecution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Bounds how many executions run at once, store-wide.
 *
 * Every decision runs in one transaction that first locks the gate row
 * ({@code SELECT ... FOR UPDATE}), so check and update cannot interleave with
 * another instance's. In SEQUENTIAL mode the ceiling is 1 and no second execution
 * may even be pending while one is active.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConcurrencyGate {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final PipelineExecutionStore store;
    private final CurationProperties properties;

    /**
     * Tries to move a pending execution to running.
     *
     * @return false when the ceiling is reached or the execution is not pending; the row is unchanged
     */
    public boolean tryStart(long executionId) {
        int ceiling = properties.getPipeline().ceiling();
        Boolean started = transactionTemplate.execute(status -> {
            lockGate();
            return store.startIfBelowCeiling(executionId, ceiling);
        });
        if (Boolean.TRUE.equals(started)) {
            log.info("Execution {} admitted to run (ceiling {})", executionId, ceiling);
            return true;
        }
        log.debug("Execution {} not started: ceiling {} reached or not pending", executionId, ceiling);
        return false;
    }

    /**
     * Creates a pending execution.
     *
     * @return empty in SEQUENTIAL mode when another execution is already pending or running
     */
    public Optional<PipelineExecution> admit(String pipelineName, LocalDate runDate, String configSnapshot) {
        return transactionTemplate.execute(status -> {
            lockGate();
            if (isSequential() && store.countActive() > 0) {
                log.info("Refusing new {} execution for {}: another execution is active", pipelineName, runDate);
                return Optional.<PipelineExecution>empty();
            }
            return Optional.of(store.createExecution(pipelineName, runDate, configSnapshot, ExecutionStatus.PENDING));
        });
    }

    /**
     * Moves a failed or partial execution back to pending for resumption. Stage runs from
     * {@code last_successful_stage + 1} on are reset to pending in the same transaction,
     * before the execution becomes visible to the driving loop.
     *
     * @return false in SEQUENTIAL mode when another execution is active, or when the
     *         execution is not failed or partial
     */
    public boolean reopen(long executionId) {
        Boolean reopened = transactionTemplate.execute(status -> {
            lockGate();
            if (isSequential() && store.countActive() > 0) {
                log.info("Cannot reopen execution {}: another execution is active", executionId);
                return false;
            }
            Optional<PipelineExecution> execution = store.findExecution(executionId)
                    .filter(e -> ExecutionStatus.RESUMABLE.contains(e.getStatus()));
            if (execution.isEmpty()) {
                return false;
            }
            Integer lastSuccessful = execution.get().getLastSuccessfulStage();
            store.invalidateSubsequentStages(executionId, lastSuccessful == null ? 1 : lastSuccessful + 1);
            return store.reopen(executionId);
        });
        return Boolean.TRUE.equals(reopened);
    }

    private void lockGate() {
        jdbcTemplate.queryForObject("SELECT lock_key FROM pipeline_gate WHERE lock_key = ? FOR UPDATE",
                Long.class, PipelineExecutionStore.GATE_KEY);
    }

    private boolean isSequential() {
        return properties.getPipeline().getGateMode() == CurationProperties.Pipeline.GateMode.SEQUENTIAL;
    }
}
