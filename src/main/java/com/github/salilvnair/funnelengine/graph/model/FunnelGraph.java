package com.github.salilvnair.funnelengine.graph.model;

import com.github.salilvnair.funnelengine.graph.FunnelGraphValidator;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated funnel. Instances only exist for graphs that passed
 * {@link FunnelGraphValidator}; lookups by block id or stage name are O(1).
 */
public final class FunnelGraph {

    private final String startBlockId;
    private final List<FunnelStage> stages;
    private final Map<String, FunnelBlock> blocks;
    private final Map<String, FunnelStage> stageByBlockId;
    private final Map<String, FunnelStage> stageByName;

    private FunnelGraph(String startBlockId, List<FunnelStage> stages, Map<String, FunnelBlock> blocks) {
        this.startBlockId = startBlockId;
        this.stages = List.copyOf(stages);
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        Map<String, FunnelStage> byBlock = new HashMap<>();
        Map<String, FunnelStage> byName = new HashMap<>();
        for (FunnelStage stage : this.stages) {
            byName.putIfAbsent(normalizeStageName(stage.name()), stage);
            for (String blockId : stage.blockIds()) {
                byBlock.put(blockId, stage);
            }
        }
        this.stageByBlockId = Collections.unmodifiableMap(byBlock);
        this.stageByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Validates and builds a graph.
     *
     * @throws com.github.salilvnair.funnelengine.engine.exception.GraphIntegrityException
     *         listing every violation when the graph is malformed
     */
    public static FunnelGraph of(String startBlockId, List<FunnelStage> stages, Map<String, FunnelBlock> blocks) {
        FunnelGraphValidator.validateOrThrow(startBlockId, stages, blocks);
        return new FunnelGraph(startBlockId, stages, blocks);
    }

    public String startBlockId() {
        return startBlockId;
    }

    public List<FunnelStage> stages() {
        return stages;
    }

    public Map<String, FunnelBlock> blocks() {
        return blocks;
    }

    public FunnelBlock startBlock() {
        return blocks.get(startBlockId);
    }

    public Optional<FunnelBlock> resolveBlock(String blockId) {
        return blockId == null ? Optional.empty() : Optional.ofNullable(blocks.get(blockId));
    }

    public Optional<FunnelStage> stageOf(String blockId) {
        return blockId == null ? Optional.empty() : Optional.ofNullable(stageByBlockId.get(blockId));
    }

    public Optional<FunnelStage> stageNamed(String stageName) {
        return Optional.ofNullable(stageByName.get(normalizeStageName(stageName)));
    }

    public boolean isInStageNamed(String blockId, String stageName) {
        return stageOf(blockId)
                .map(stage -> normalizeStageName(stage.name()).equals(normalizeStageName(stageName)))
                .orElse(false);
    }

    public static String normalizeStageName(String stageName) {
        return stageName == null ? "" : stageName.trim().toUpperCase(Locale.ROOT);
    }
}
