package com.newsintel.curator.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an external command as a stage. {@code {run_date}} and {@code {pipeline}} in the
 * arguments are substituted. A non-zero exit code fails the stage; interruption kills
 * the process.
 */
@Slf4j
public class CommandStage implements PipelineStage {

    private static final int OUTPUT_TAIL_LINES = 20;

    private final String name;
    private final List<String> command;

    public CommandStage(String name, List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Stage " + name + " has no command");
        }
        this.name = name;
        this.command = List.copyOf(command);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, Object> execute(StageContext context) throws Exception {
        List<String> resolved = resolve(command, context);
        log.info("[{}] Running: {}", name, String.join(" ", resolved));

        long start = System.currentTimeMillis();
        Process process = new ProcessBuilder(resolved).redirectErrorStream(true).start();
        Deque<String> tail = new ArrayDeque<>();
        Thread drainer = new Thread(() -> drain(process, tail), "stage-" + name + "-output");
        drainer.setDaemon(true);
        drainer.start();
        try {
            int exitCode = process.waitFor();
            drainer.join(1000);
            long durationMs = System.currentTimeMillis() - start;

            if (exitCode != 0) {
                String lastLine;
                synchronized (tail) {
                    lastLine = tail.peekLast();
                }
                throw new IllegalStateException("Command exited with code " + exitCode
                        + (lastLine == null ? "" : ": " + lastLine));
            }

            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("exit_code", exitCode);
            metrics.put("duration_ms", durationMs);
            return metrics;
        } finally {
            if (process.isAlive()) {
                log.warn("[{}] Stopping command", name);
                process.destroyForcibly();
            }
        }
    }

    static List<String> resolve(List<String> command, StageContext context) {
        return command.stream()
                .map(arg -> arg.replace("{run_date}", context.runDate().toString())
                        .replace("{pipeline}", context.pipelineName()))
                .toList();
    }

    private void drain(Process process, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", name, line);
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > OUTPUT_TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            log.debug("[{}] Output stream closed: {}", name, e.getMessage());
        }
    }
}
