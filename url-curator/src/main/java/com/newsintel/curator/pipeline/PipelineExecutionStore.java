package com.newsintel.curator.pipeline;

import com.newsintel.curator.model.ExecutionStatus;
import com.newsintel.curator.model.PipelineExecution;
import com.newsintel.curator.model.StageRun;
import com.newsintel.curator.model.StageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent state of pipeline executions and their stage runs.
 *
 * Every transition is a conditional UPDATE on the allowed predecessor states, so two
 * writers racing on the same row cannot both win. Rows are never deleted.
 *
 * Stage state machine:
 *   pending → running → completed
 *                     → failed
 *   pending → failed
 *   completed|failed → pending   (only through invalidateSubsequentStages)
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class PipelineExecutionStore {

    /** Row in pipeline_gate locked by the concurrency gate. */
    public static final long GATE_KEY = 99999L;

    private static final String EXECUTION_COLUMNS = """
            id, pipeline_name, run_date, config_snapshot, status,
            created_at, started_at, completed_at, last_successful_stage
            """;

    private static final String STAGE_COLUMNS = """
            id, execution_id, stage_number, name, status,
            started_at, completed_at, heartbeat_at, error_message, metrics
            """;

    private static final RowMapper<PipelineExecution> EXECUTION_MAPPER = (rs, rowNum) -> PipelineExecution.builder()
            .id(rs.getLong("id"))
            .pipelineName(rs.getString("pipeline_name"))
            .runDate(rs.getObject("run_date", LocalDate.class))
            .configSnapshot(rs.getString("config_snapshot"))
            .status(ExecutionStatus.fromDb(rs.getString("status")))
            .createdAt(rs.getObject("created_at", LocalDateTime.class))
            .startedAt(rs.getObject("started_at", LocalDateTime.class))
            .completedAt(rs.getObject("completed_at", LocalDateTime.class))
            .lastSuccessfulStage(rs.getObject("last_successful_stage", Integer.class))
            .build();

    private static final RowMapper<StageRun> STAGE_MAPPER = (rs, rowNum) -> StageRun.builder()
            .id(rs.getLong("id"))
            .executionId(rs.getLong("execution_id"))
            .stageNumber(rs.getInt("stage_number"))
            .name(rs.getString("name"))
            .status(StageStatus.fromDb(rs.getString("status")))
            .startedAt(rs.getObject("started_at", LocalDateTime.class))
            .completedAt(rs.getObject("completed_at", LocalDateTime.class))
            .heartbeatAt(rs.getObject("heartbeat_at", LocalDateTime.class))
            .errorMessage(rs.getString("error_message"))
            .metrics(rs.getString("metrics"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    // ── Schema ───────────────────────────────────────────────────────────────

    public void ensureSchema() {
        log.info("Ensuring pipeline schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_executions
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                pipeline_name           VARCHAR(200) NOT NULL,
                run_date                DATE         NOT NULL,
                config_snapshot         VARCHAR      NOT NULL,
                status                  VARCHAR(20)  NOT NULL
                    CHECK (status IN ('pending', 'running', 'completed', 'partial', 'failed')),
                created_at              TIMESTAMP    NOT NULL,
                started_at              TIMESTAMP,
                completed_at            TIMESTAMP,
                last_successful_stage   INTEGER
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_pipeline_executions_status
                ON pipeline_executions (status, created_at)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS stage_runs
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                execution_id    BIGINT       NOT NULL REFERENCES pipeline_executions (id),
                stage_number    INTEGER      NOT NULL CHECK (stage_number >= 1),
                name            VARCHAR(200) NOT NULL,
                status          VARCHAR(20)  NOT NULL
                    CHECK (status IN ('pending', 'running', 'completed', 'failed')),
                started_at      TIMESTAMP,
                completed_at    TIMESTAMP,
                heartbeat_at    TIMESTAMP,
                error_message   VARCHAR,
                metrics         VARCHAR
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_stage_runs_execution
                ON stage_runs (execution_id, stage_number)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_gate
            (
                lock_key    BIGINT PRIMARY KEY
            )
        """);
        Integer gateRows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pipeline_gate WHERE lock_key = ?", Integer.class, GATE_KEY);
        if (gateRows == null || gateRows == 0) {
            try {
                jdbcTemplate.update("INSERT INTO pipeline_gate (lock_key) VALUES (?)", GATE_KEY);
            } catch (DuplicateKeyException e) {
                log.debug("Gate row inserted concurrently by another instance");
            }
        }

        log.info("Pipeline schema ready.");
    }

    // ── Executions ───────────────────────────────────────────────────────────

    public PipelineExecution createExecution(String pipelineName, LocalDate runDate, String configSnapshot,
                                             ExecutionStatus initialStatus) {
        if (initialStatus != ExecutionStatus.PENDING && initialStatus != ExecutionStatus.RUNNING) {
            throw new IllegalArgumentException("New executions start pending or running, not " + initialStatus);
        }
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO pipeline_executions
                    (pipeline_name, run_date, config_snapshot, status, created_at, started_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """, Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, pipelineName);
            ps.setDate(2, Date.valueOf(runDate));
            ps.setString(3, configSnapshot);
            ps.setString(4, initialStatus.dbValue());
            ps.setTimestamp(5, now);
            ps.setTimestamp(6, initialStatus == ExecutionStatus.RUNNING ? now : null);
            return ps;
        }, keys);

        long id = generatedId(keys);
        log.info("Created pipeline execution {} ({} for {}, {})", id, pipelineName, runDate, initialStatus.dbValue());
        return findExecution(id).orElseThrow();
    }

    public Optional<PipelineExecution> findExecution(long id) {
        return jdbcTemplate.query("SELECT " + EXECUTION_COLUMNS + " FROM pipeline_executions WHERE id = ?",
                EXECUTION_MAPPER, id).stream().findFirst();
    }

    /** Pending executions, oldest first. */
    public List<PipelineExecution> findPendingExecutions() {
        return jdbcTemplate.query("SELECT " + EXECUTION_COLUMNS
                        + " FROM pipeline_executions WHERE status = 'pending' ORDER BY created_at, id",
                EXECUTION_MAPPER);
    }

    /**
     * The most recent failed or partial execution, optionally for one pipeline.
     */
    public Optional<PipelineExecution> getLastFailedExecution(String pipelineName) {
        if (pipelineName == null) {
            return jdbcTemplate.query("SELECT " + EXECUTION_COLUMNS + """
                     FROM pipeline_executions
                    WHERE status IN ('failed', 'partial')
                    ORDER BY created_at DESC, id DESC
                    LIMIT 1
                    """, EXECUTION_MAPPER).stream().findFirst();
        }
        return jdbcTemplate.query("SELECT " + EXECUTION_COLUMNS + """
                 FROM pipeline_executions
                WHERE status IN ('failed', 'partial') AND pipeline_name = ?
                ORDER BY created_at DESC, id DESC
                LIMIT 1
                """, EXECUTION_MAPPER, pipelineName).stream().findFirst();
    }

    public int countActive() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pipeline_executions WHERE status IN ('pending', 'running')", Integer.class);
        return count == null ? 0 : count;
    }

    /**
     * Moves a pending execution to running if fewer than {@code ceiling} other executions
     * are running. Callers hold the gate lock.
     *
     * @return true if this call started the execution
     */
    boolean startIfBelowCeiling(long executionId, int ceiling) {
        int updated = jdbcTemplate.update("""
                UPDATE pipeline_executions
                SET status = 'running', started_at = COALESCE(started_at, ?)
                WHERE id = ?
                  AND status = 'pending'
                  AND (SELECT COUNT(*) FROM pipeline_executions other
                       WHERE other.status = 'running' AND other.id <> ?) < ?
                """, Timestamp.valueOf(LocalDateTime.now()), executionId, executionId, ceiling);
        return updated == 1;
    }

    /**
     * Failed or partial back to pending. started_at is cleared so it records the restart.
     * Callers hold the gate lock.
     */
    boolean reopen(long executionId) {
        return jdbcTemplate.update("""
                UPDATE pipeline_executions
                SET status = 'pending', started_at = NULL, completed_at = NULL
                WHERE id = ? AND status IN ('failed', 'partial')
                """, executionId) == 1;
    }

    public void recordStageSuccess(long executionId, int stageNumber) {
        jdbcTemplate.update("UPDATE pipeline_executions SET last_successful_stage = ? WHERE id = ?",
                stageNumber, executionId);
    }

    /**
     * Closes a running execution.
     *
     * @throws IllegalArgumentException if status is not completed, partial or failed
     * @throws IllegalStateException    if the execution is no longer running
     */
    public void completeExecution(long executionId, ExecutionStatus status, Integer lastSuccessfulStage) {
        if (!ExecutionStatus.FINAL.contains(status)) {
            throw new IllegalArgumentException("Not a final execution status: " + status);
        }
        int updated = jdbcTemplate.update("""
                UPDATE pipeline_executions
                SET status = ?, last_successful_stage = ?, completed_at = ?
                WHERE id = ? AND status = 'running'
                """, status.dbValue(), lastSuccessfulStage, Timestamp.valueOf(LocalDateTime.now()), executionId);
        if (updated != 1) {
            throw new IllegalStateException("Execution " + executionId + " is not running");
        }
        log.info("Execution {} finished as {} (last successful stage: {})",
                executionId, status.dbValue(), lastSuccessfulStage);
    }

    // ── Stage runs ───────────────────────────────────────────────────────────

    public StageRun createStage(long executionId, int stageNumber, String name) {
        if (stageNumber < 1) {
            throw new IllegalArgumentException("Stage numbers start at 1");
        }
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO stage_runs (execution_id, stage_number, name, status)
                    VALUES (?, ?, ?, 'pending')
                    """, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, executionId);
            ps.setInt(2, stageNumber);
            ps.setString(3, name);
            return ps;
        }, keys);
        return findStage(generatedId(keys)).orElseThrow();
    }

    public Optional<StageRun> findStage(long stageRunId) {
        return jdbcTemplate.query("SELECT " + STAGE_COLUMNS + " FROM stage_runs WHERE id = ?",
                STAGE_MAPPER, stageRunId).stream().findFirst();
    }

    public List<StageRun> findStages(long executionId) {
        return jdbcTemplate.query("SELECT " + STAGE_COLUMNS
                        + " FROM stage_runs WHERE execution_id = ? ORDER BY stage_number, id",
                STAGE_MAPPER, executionId);
    }

    /** Most recent run of a stage number within an execution. */
    public Optional<StageRun> findLatestStage(long executionId, int stageNumber) {
        return jdbcTemplate.query("SELECT " + STAGE_COLUMNS + """
                 FROM stage_runs
                WHERE execution_id = ? AND stage_number = ?
                ORDER BY id DESC
                LIMIT 1
                """, STAGE_MAPPER, executionId, stageNumber).stream().findFirst();
    }

    /**
     * Compare-and-set transition of one stage run.
     *
     * @param errorMessage recorded for failed, ignored otherwise
     * @param metrics      JSON recorded for completed and failed, may be null
     * @throws IllegalStageTransitionException if the row is not in an allowed predecessor state
     */
    public void transitionStage(long stageRunId, StageStatus target, String errorMessage, String metrics) {
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        int updated = switch (target) {
            case RUNNING -> jdbcTemplate.update("""
                    UPDATE stage_runs
                    SET status = 'running', started_at = ?, heartbeat_at = ?
                    WHERE id = ? AND status = 'pending'
                    """, now, now, stageRunId);
            case COMPLETED -> jdbcTemplate.update("""
                    UPDATE stage_runs
                    SET status = 'completed', completed_at = ?, heartbeat_at = ?, metrics = ?, error_message = NULL
                    WHERE id = ? AND status = 'running'
                    """, now, now, metrics, stageRunId);
            case FAILED -> jdbcTemplate.update("""
                    UPDATE stage_runs
                    SET status = 'failed', completed_at = ?, error_message = ?, metrics = ?
                    WHERE id = ? AND status IN ('pending', 'running')
                    """, now, errorMessage, metrics, stageRunId);
            case PENDING -> throw new IllegalArgumentException(
                    "Stages return to pending only through invalidateSubsequentStages");
        };

        if (updated != 1) {
            String current = findStage(stageRunId).map(s -> s.getStatus().dbValue()).orElse("missing");
            throw new IllegalStageTransitionException(stageRunId, current, target);
        }
        log.debug("Stage run {} -> {}", stageRunId, target.dbValue());
    }

    /** @return false if the stage is no longer running */
    public boolean heartbeat(long stageRunId) {
        return jdbcTemplate.update("UPDATE stage_runs SET heartbeat_at = ? WHERE id = ? AND status = 'running'",
                Timestamp.valueOf(LocalDateTime.now()), stageRunId) == 1;
    }

    /**
     * Resets every stage run numbered {@code fromStage} or higher to pending so a resume
     * re-runs them with fresh input. Earlier stages are not touched.
     *
     * @return rows reset
     */
    public int invalidateSubsequentStages(long executionId, int fromStage) {
        int reset = jdbcTemplate.update("""
                UPDATE stage_runs
                SET status = 'pending', completed_at = NULL, error_message = NULL,
                    heartbeat_at = NULL, metrics = NULL
                WHERE execution_id = ? AND stage_number >= ?
                """, executionId, fromStage);
        log.info("Invalidated {} stage runs of execution {} from stage {}", reset, executionId, fromStage);
        return reset;
    }

    /**
     * Fails running stages whose last heartbeat is older than {@code cutoff}, and closes their
     * executions as partial or failed so they can be resumed.
     *
     * @return stage runs failed
     */
    public int failAbandonedStages(LocalDateTime cutoff) {
        List<StageRun> stale = jdbcTemplate.query("SELECT " + STAGE_COLUMNS + """
                 FROM stage_runs
                WHERE status = 'running' AND COALESCE(heartbeat_at, started_at) < ?
                ORDER BY id
                """, STAGE_MAPPER, Timestamp.valueOf(cutoff));

        int failed = 0;
        for (StageRun run : stale) {
            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            String reason = "abandoned: no heartbeat since " + run.getHeartbeatAt();
            int updated = jdbcTemplate.update("""
                    UPDATE stage_runs
                    SET status = 'failed', completed_at = ?, error_message = ?
                    WHERE id = ? AND status = 'running'
                    """, now, reason, run.getId());
            if (updated != 1) {
                continue;
            }
            failed++;
            jdbcTemplate.update("""
                    UPDATE pipeline_executions
                    SET status = CASE WHEN last_successful_stage IS NULL THEN 'failed' ELSE 'partial' END,
                        completed_at = ?
                    WHERE id = ? AND status = 'running'
                    """, now, run.getExecutionId());
            log.warn("Stage {} ({}) of execution {} abandoned, marked failed",
                    run.getStageNumber(), run.getName(), run.getExecutionId());
        }
        return failed;
    }

    /**
     * Closes running executions that have no running stage and no activity since
     * {@code cutoff}: the driver died between stages, or after starting the execution and
     * before its first stage. They end as partial or failed so they can be resumed.
     *
     * @return executions closed
     */
    public int failStalledExecutions(LocalDateTime cutoff) {
        int closed = jdbcTemplate.update("""
                UPDATE pipeline_executions e
                SET status = CASE WHEN e.last_successful_stage IS NULL THEN 'failed' ELSE 'partial' END,
                    completed_at = ?
                WHERE e.status = 'running'
                  AND COALESCE(e.started_at, e.created_at) < ?
                  AND NOT EXISTS (SELECT 1 FROM stage_runs s
                                  WHERE s.execution_id = e.id
                                    AND (s.status = 'running' OR s.completed_at >= ?))
                """, Timestamp.valueOf(LocalDateTime.now()), Timestamp.valueOf(cutoff), Timestamp.valueOf(cutoff));
        if (closed > 0) {
            log.warn("Closed {} running executions with no live stage since {}", closed, cutoff);
        }
        return closed;
    }

    private static long generatedId(KeyHolder keys) {
        Map<String, Object> row = keys.getKeys();
        if (row == null || row.get("id") == null) {
            throw new IllegalStateException("Insert returned no generated id");
        }
        return ((Number) row.get("id")).longValue();
    }
}
