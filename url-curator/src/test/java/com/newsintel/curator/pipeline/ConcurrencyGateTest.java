package com.newsintel.curator.pipeline;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.ExecutionStatus;
import com.newsintel.curator.model.PipelineExecution;
import com.newsintel.curator.model.StageRun;
import com.newsintel.curator.model.StageStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyGateTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2025, 11, 10);

    private PipelineTestDatabase db;
    private CurationProperties properties;
    private ConcurrencyGate gate;

    @BeforeEach
    void setUp() {
        db = new PipelineTestDatabase();
        properties = new CurationProperties();
        gate = new ConcurrencyGate(db.jdbcTemplate, db.transactionTemplate, db.store, properties);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private long pending() {
        return db.store.createExecution("daily-curation", RUN_DATE, "{}", ExecutionStatus.PENDING).getId();
    }

    @Test
    void sequentialModeAdmitsOneActiveExecution() {
        Optional<PipelineExecution> first = gate.admit("daily-curation", RUN_DATE, "{}");
        Optional<PipelineExecution> second = gate.admit("daily-curation", RUN_DATE, "{}");

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(db.store.countActive()).isEqualTo(1);
    }

    @Test
    void boundedParallelModeAdmitsManyButStartsUpToTheCeiling() {
        properties.getPipeline().setGateMode(CurationProperties.Pipeline.GateMode.BOUNDED_PARALLEL);
        properties.getPipeline().setMaxRunning(2);

        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            ids.add(gate.admit("daily-curation", RUN_DATE, "{}").orElseThrow().getId());
        }

        assertThat(gate.tryStart(ids.get(0))).isTrue();
        assertThat(gate.tryStart(ids.get(1))).isTrue();
        assertThat(gate.tryStart(ids.get(2))).isFalse();
        assertThat(db.store.findExecution(ids.get(2)).orElseThrow().getStatus()).isEqualTo(ExecutionStatus.PENDING);
    }

    @Test
    void startingTwiceIsRefused() {
        long id = pending();

        assertThat(gate.tryStart(id)).isTrue();
        assertThat(gate.tryStart(id)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3})
    void concurrentStartsNeverExceedTheCeiling(int ceiling) throws Exception {
        properties.getPipeline().setGateMode(ceiling == 1
                ? CurationProperties.Pipeline.GateMode.SEQUENTIAL
                : CurationProperties.Pipeline.GateMode.BOUNDED_PARALLEL);
        properties.getPipeline().setMaxRunning(ceiling);

        int contenders = 8;
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            ids.add(pending());
        }

        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        for (long id : ids) {
            attempts.add(pool.submit(() -> {
                go.await();
                return gate.tryStart(id);
            }));
        }
        go.countDown();

        int started = 0;
        for (Future<Boolean> attempt : attempts) {
            if (attempt.get(30, TimeUnit.SECONDS)) {
                started++;
            }
        }
        pool.shutdown();

        assertThat(started).isEqualTo(ceiling);
        Integer running = db.jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pipeline_executions WHERE status = 'running'", Integer.class);
        assertThat(running).isEqualTo(ceiling);
    }

    @Test
    void reopenMovesFailedExecutionsBackToPending() {
        long id = db.store.createExecution("daily-curation", RUN_DATE, "{}", ExecutionStatus.RUNNING).getId();
        db.store.completeExecution(id, ExecutionStatus.FAILED, null);

        assertThat(gate.reopen(id)).isTrue();
        assertThat(db.store.findExecution(id).orElseThrow().getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(gate.reopen(id)).isFalse();
    }

    @Test
    void reopenResetsStagesAfterTheLastSuccessfulOne() {
        long id = db.store.createExecution("daily-curation", RUN_DATE, "{}", ExecutionStatus.RUNNING).getId();
        for (int number = 1; number <= 3; number++) {
            StageRun run = db.store.createStage(id, number, "s" + number);
            db.store.transitionStage(run.getId(), StageStatus.RUNNING, null, null);
            db.store.transitionStage(run.getId(), number == 3 ? StageStatus.FAILED : StageStatus.COMPLETED,
                    number == 3 ? "boom" : null, null);
        }
        db.store.completeExecution(id, ExecutionStatus.PARTIAL, 2);

        assertThat(gate.reopen(id)).isTrue();

        assertThat(db.store.findLatestStage(id, 2)).map(StageRun::getStatus).contains(StageStatus.COMPLETED);
        assertThat(db.store.findLatestStage(id, 3)).map(StageRun::getStatus).contains(StageStatus.PENDING);
        PipelineExecution reopened = db.store.findExecution(id).orElseThrow();
        assertThat(reopened.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(reopened.getStartedAt()).isNull();
    }

    @Test
    void reopenIsRefusedWhileAnotherExecutionIsActiveInSequentialMode() {
        long failed = db.store.createExecution("daily-curation", RUN_DATE, "{}", ExecutionStatus.RUNNING).getId();
        db.store.completeExecution(failed, ExecutionStatus.PARTIAL, 2);
        pending();

        assertThat(gate.reopen(failed)).isFalse();
        assertThat(db.store.findExecution(failed).orElseThrow().getStatus()).isEqualTo(ExecutionStatus.PARTIAL);
    }
}
