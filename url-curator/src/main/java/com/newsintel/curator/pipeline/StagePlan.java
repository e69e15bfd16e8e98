package com.newsintel.curator.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsintel.curator.config.CurationProperties;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered stages of one execution, with the run parameters they were planned with.
 * Stored as the execution's config snapshot so resume and replay use exactly this plan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StagePlan(@JsonProperty("pipeline") String pipelineName,
                        @JsonProperty("run_date") String runDate,
                        @JsonProperty("gate_mode") String gateMode,
                        @JsonProperty("stages") List<PlannedStage> stages) {

    public StagePlan {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlannedStage(@JsonProperty("number") int number,
                               @JsonProperty("name") String name,
                               @JsonProperty("command") List<String> command,
                               @JsonProperty("timeout_ms") long timeoutMs) {

        public PlannedStage {
            command = command == null ? List.of() : List.copyOf(command);
        }

        public Duration timeout() {
            return Duration.ofMillis(timeoutMs);
        }
    }

    public static StagePlan fromProperties(CurationProperties.Pipeline pipeline, String pipelineName, LocalDate runDate) {
        if (pipeline.getStages().isEmpty()) {
            throw new IllegalStateException("No stages configured under curation.pipeline.stages");
        }
        List<PlannedStage> stages = new ArrayList<>();
        int number = 1;
        for (CurationProperties.StageDefinition def : pipeline.getStages()) {
            if (def.getName() == null || def.getName().isBlank()) {
                throw new IllegalStateException("Stage " + number + " has no name");
            }
            Duration timeout = def.getTimeout() != null ? def.getTimeout() : pipeline.getStageTimeout();
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalStateException("Stage " + def.getName() + " has a non-positive timeout");
            }
            stages.add(new PlannedStage(number++, def.getName(), def.getCommand(), timeout.toMillis()));
        }
        return new StagePlan(pipelineName, runDate.toString(), pipeline.getGateMode().name(), stages);
    }

    public static StagePlan fromSnapshot(String json, ObjectMapper objectMapper) {
        try {
            return objectMapper.readValue(json, StagePlan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable config snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public String toSnapshot(ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize stage plan", e);
        }
    }

    public int size() {
        return stages.size();
    }
}
