package com.newsintel.curator.pipeline;

import java.util.Map;

/**
 * One step of the pipeline. Implementations must respond to thread interruption,
 * which is how cancellation and timeouts reach them.
 */
public interface PipelineStage {

    String name();

    /**
     * @return metrics recorded on the stage run
     * @throws Exception any failure; the stage run is marked failed with its message
     */
    Map<String, Object> execute(StageContext context) throws Exception;
}
