package com.newsintel.curator.config;

import com.newsintel.curator.discovery.PatternDiscoveryService;
import com.newsintel.curator.model.ExecutionStatus;
import com.newsintel.curator.pipeline.PipelineExecutionStore;
import com.newsintel.curator.pipeline.PipelineRunner;
import com.newsintel.curator.rules.RuleSnapshot;
import com.newsintel.curator.rules.RuleSnapshotHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CurationController {

    private final PipelineRunner runner;
    private final PipelineExecutionStore executionStore;
    private final PatternDiscoveryService discoveryService;
    private final RuleSnapshotHolder snapshotHolder;
    private final CurationProperties properties;

    // ── Pipeline triggers ─────────────────────────────────────────────────────

    /**
     * POST /pipeline/run?date=2025-11-10
     *
     * Runs in the background; poll GET /pipeline/executions/{id} for progress.
     */
    @PostMapping("/pipeline/run")
    public ResponseEntity<Map<String, String>> run(@RequestParam(required = false) String date) {
        LocalDate runDate;
        try {
            runDate = date == null ? LocalDate.now(ZoneOffset.UTC) : LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "date must be YYYY-MM-DD"));
        }
        String pipeline = properties.getPipeline().getName();
        new Thread(() -> runInBackground(() -> runner.submit(pipeline, runDate)), "manual-run-" + runDate).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "pipeline", pipeline,
                "runDate", runDate.toString()));
    }

    @PostMapping("/pipeline/resume")
    public ResponseEntity<Map<String, String>> resume(@RequestParam(required = false) Long executionId) {
        var target = executionId != null
                ? executionStore.findExecution(executionId)
                : executionStore.getLastFailedExecution(null);
        if (target.isEmpty() || !ExecutionStatus.RESUMABLE.contains(target.get().getStatus())) {
            return ResponseEntity.badRequest().body(Map.of("error", "No failed or partial execution to resume"));
        }
        new Thread(() -> runInBackground(() -> runner.resume(executionId)), "manual-resume").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted",
                "target", executionId == null ? "last failed" : String.valueOf(executionId)));
    }

    @PostMapping("/pipeline/replay/{id}")
    public ResponseEntity<Map<String, String>> replay(@PathVariable long id) {
        if (executionStore.findExecution(id).isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown execution " + id));
        }
        new Thread(() -> runInBackground(() -> runner.replay(id)), "manual-replay-" + id).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "replayOf", String.valueOf(id)));
    }

    @PostMapping("/pipeline/cancel/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable long id) {
        boolean cancelled = runner.cancel(id);
        return ResponseEntity.ok(Map.of("executionId", id, "cancelled", cancelled));
    }

    @GetMapping("/pipeline/executions/{id}")
    public ResponseEntity<?> execution(@PathVariable long id) {
        try {
            return executionStore.findExecution(id)
                    .<ResponseEntity<?>>map(execution -> {
                        Map<String, Object> body = new LinkedHashMap<>();
                        body.put("execution", execution);
                        body.put("stages", executionStore.findStages(id));
                        return ResponseEntity.ok(body);
                    })
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            log.error("Execution lookup failed for {}: {}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Rules ─────────────────────────────────────────────────────────────────

    @PostMapping("/discovery/trigger")
    public ResponseEntity<Map<String, Object>> triggerDiscovery(@RequestParam(required = false) List<String> sources) {
        Set<String> targets = sources == null ? Set.of() : Set.copyOf(sources);
        new Thread(() -> {
            try {
                discoveryService.discoverAndMerge(targets);
            } catch (Exception e) {
                log.error("Manual discovery failed: {}", e.getMessage(), e);
            }
        }, "manual-discovery").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted",
                "sources", targets.isEmpty() ? "all" : targets));
    }

    @PostMapping("/rules/reload")
    public ResponseEntity<?> reloadRules() {
        try {
            return ResponseEntity.ok(describe(snapshotHolder.reload()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Rule reload failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/rules/status")
    public ResponseEntity<Map<String, Object>> rulesStatus() {
        return ResponseEntity.ok(describe(snapshotHolder.current()));
    }

    private Map<String, Object> describe(RuleSnapshot snapshot) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("globalRules", snapshot.globalRuleCount());
        body.put("sourceRules", snapshot.sourceRuleCount());
        body.put("cachedNoiseUrls", snapshot.cachedUrlCount());
        body.put("loadedAt", String.valueOf(snapshot.loadedAt()));
        return body;
    }

    private void runInBackground(Supplier<PipelineRunner.RunResult> action) {
        try {
            PipelineRunner.RunResult result = action.get();
            log.info("Manual pipeline action {}: execution {} ({})",
                    result.outcome(), result.executionId(), result.status());
        } catch (Exception e) {
            log.error("Manual pipeline action failed: {}", e.getMessage(), e);
        }
    }
}
