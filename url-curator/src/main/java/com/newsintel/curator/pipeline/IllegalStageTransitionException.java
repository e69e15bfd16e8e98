package com.newsintel.curator.pipeline;

import com.newsintel.curator.model.StageStatus;

/**
 * A stage run was not in a state the requested transition may start from.
 */
public class IllegalStageTransitionException extends RuntimeException {

    private final long stageRunId;
    private final StageStatus target;

    public IllegalStageTransitionException(long stageRunId, String currentStatus, StageStatus target) {
        super("Stage run " + stageRunId + " cannot move from " + currentStatus + " to " + target.dbValue());
        this.stageRunId = stageRunId;
        this.target = target;
    }

    public long getStageRunId() {
        return stageRunId;
    }

    public StageStatus getTarget() {
        return target;
    }
}
