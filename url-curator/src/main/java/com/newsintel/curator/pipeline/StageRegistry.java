package com.newsintel.curator.pipeline;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves planned stages to runnable ones: built-in stages by name, anything else
 * as an external command.
 */
@Component
public class StageRegistry {

    private final Map<String, PipelineStage> builtIns;

    public StageRegistry(List<PipelineStage> builtIns) {
        this.builtIns = builtIns.stream()
                .collect(Collectors.toMap(PipelineStage::name, Function.identity()));
    }

    public PipelineStage resolve(StagePlan.PlannedStage planned) {
        PipelineStage builtIn = builtIns.get(planned.name());
        if (builtIn != null) {
            return builtIn;
        }
        if (planned.command().isEmpty()) {
            throw new IllegalArgumentException("Stage '" + planned.name() + "' is not built in and has no command");
        }
        return new CommandStage(planned.name(), planned.command());
    }
}
