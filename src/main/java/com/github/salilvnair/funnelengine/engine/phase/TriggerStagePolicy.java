package com.github.salilvnair.funnelengine.engine.phase;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether entering a block should request the one-time action.
 */
@Component
@RequiredArgsConstructor
public class TriggerStagePolicy {

    private final FunnelEngineConfig config;

    public boolean isTriggerBlock(FunnelGraph graph, String blockId) {
        return config.getGraph().getTriggerStages().stream()
                .anyMatch(stage -> graph.isInStageNamed(blockId, stage));
    }
}
