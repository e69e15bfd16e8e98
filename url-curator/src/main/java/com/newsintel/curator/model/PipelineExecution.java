package com.newsintel.curator.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One end-to-end attempt at running the staged pipeline for a run date.
 * Stored in the pipeline_executions table; only status, timestamps and
 * last_successful_stage change after insert.
 */
@Data
@Builder
public class PipelineExecution {

    private Long id;
    private String pipelineName;
    private LocalDate runDate;
    private String configSnapshot;      // JSON, written once
    private ExecutionStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Integer lastSuccessfulStage; // null until a stage completes
}
