package com.github.salilvnair.funnelengine.engine.phase;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import com.github.salilvnair.funnelengine.graph.model.FunnelStage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps the stage of a block onto the re-prompt phase it belongs to.
 */
@Component
@RequiredArgsConstructor
public class PhaseDetector {

    static final String TRANSITION_STAGE = "TRANSITION";

    private final FunnelEngineConfig config;

    public FunnelPhase phaseOf(FunnelGraph graph, String blockId) {
        String stageName = graph.stageOf(blockId)
                .map(FunnelStage::name)
                .map(FunnelGraph::normalizeStageName)
                .orElse("");
        if (contains(config.getReprompt().getPhase1Stages(), stageName)) {
            return FunnelPhase.PHASE1;
        }
        if (contains(config.getReprompt().getPhase2Stages(), stageName)) {
            return FunnelPhase.PHASE2;
        }
        if (TRANSITION_STAGE.equals(stageName)) {
            return FunnelPhase.TRANSITION;
        }
        return FunnelPhase.COMPLETED;
    }

    private boolean contains(List<String> stageNames, String normalized) {
        return !normalized.isEmpty() && stageNames != null && stageNames.stream()
                .map(FunnelGraph::normalizeStageName)
                .anyMatch(normalized::equals);
    }
}
