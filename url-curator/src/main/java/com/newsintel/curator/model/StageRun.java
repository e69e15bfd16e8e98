package com.newsintel.curator.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One attempt at one numbered stage of an execution. Stored in the stage_runs table.
 */
@Data
@Builder
public class StageRun {

    private Long id;
    private Long executionId;
    private int stageNumber;
    private String name;
    private StageStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime heartbeatAt;
    private String errorMessage;    // null unless failed
    private String metrics;         // JSON, null until completed
}
