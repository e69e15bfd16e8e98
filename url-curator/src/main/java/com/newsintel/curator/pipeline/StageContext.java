package com.newsintel.curator.pipeline;

import java.time.LocalDate;

/**
 * What a stage knows about the run it belongs to.
 */
public record StageContext(long executionId,
                           String pipelineName,
                           LocalDate runDate,
                           int stageNumber,
                           StagePlan.PlannedStage stage) {
}
