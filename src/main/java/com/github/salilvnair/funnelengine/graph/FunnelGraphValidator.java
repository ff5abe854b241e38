package com.github.salilvnair.funnelengine.graph;

import com.github.salilvnair.funnelengine.engine.exception.GraphIntegrityException;
import com.github.salilvnair.funnelengine.graph.model.BlockOption;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import com.github.salilvnair.funnelengine.graph.model.FunnelStage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Load-time structural checks for a funnel graph. Runs once, before a graph is
 * activated, so transitions never meet a dangling edge on the normal path.
 */
public final class FunnelGraphValidator {

    private FunnelGraphValidator() {
    }

    public static void validateOrThrow(String startBlockId, List<FunnelStage> stages, Map<String, FunnelBlock> blocks) {
        List<String> violations = validate(startBlockId, stages, blocks);
        if (!violations.isEmpty()) {
            throw new GraphIntegrityException(violations);
        }
    }

    public static List<String> validate(String startBlockId, List<FunnelStage> stages, Map<String, FunnelBlock> blocks) {
        List<String> violations = new ArrayList<>();
        Map<String, FunnelBlock> safeBlocks = blocks == null ? Map.of() : blocks;
        List<FunnelStage> safeStages = stages == null ? List.of() : stages;

        if (safeBlocks.isEmpty()) {
            violations.add("graph has no blocks");
        }
        if (isBlank(startBlockId)) {
            violations.add("startBlockId is null/blank");
        }
        else if (!safeBlocks.containsKey(startBlockId)) {
            violations.add("startBlockId '" + startBlockId + "' is not a block");
        }

        validateBlocks(safeBlocks, violations);
        validateStages(safeStages, safeBlocks, violations);
        return violations;
    }

    private static void validateBlocks(Map<String, FunnelBlock> blocks, List<String> violations) {
        for (Map.Entry<String, FunnelBlock> entry : blocks.entrySet()) {
            String key = entry.getKey();
            FunnelBlock block = entry.getValue();
            if (block == null) {
                violations.add("block[" + key + "] is null");
                continue;
            }
            if (!key.equals(block.id())) {
                violations.add("block[" + key + "] declares mismatching id '" + block.id() + "'");
            }
            if (block.message() == null) {
                violations.add("block[" + key + "] message is null");
            }
            for (int i = 0; i < block.options().size(); i++) {
                BlockOption option = block.options().get(i);
                if (option == null || isBlank(option.text())) {
                    violations.add("block[" + key + "].options[" + i + "] text is null/blank");
                    continue;
                }
                if (!option.isTerminal() && !blocks.containsKey(option.nextBlockId())) {
                    violations.add("block[" + key + "].options[" + i + "] nextBlockId '"
                            + option.nextBlockId() + "' is not a block");
                }
            }
        }
    }

    private static void validateStages(List<FunnelStage> stages, Map<String, FunnelBlock> blocks, List<String> violations) {
        Set<String> stageIds = new HashSet<>();
        Set<String> stageNames = new HashSet<>();
        Map<String, String> owningStage = new HashMap<>();
        for (FunnelStage stage : stages) {
            if (stage == null) {
                violations.add("stage is null");
                continue;
            }
            if (isBlank(stage.id())) {
                violations.add("stage id is null/blank");
            }
            else if (!stageIds.add(stage.id())) {
                violations.add("stage[" + stage.id() + "] duplicate id");
            }
            if (isBlank(stage.name())) {
                violations.add("stage[" + stage.id() + "] name is null/blank");
            }
            else if (!stageNames.add(FunnelGraph.normalizeStageName(stage.name()))) {
                violations.add("stage[" + stage.id() + "] duplicate name " + stage.name());
            }
            for (String blockId : stage.blockIds()) {
                if (blockId == null || !blocks.containsKey(blockId)) {
                    violations.add("stage[" + stage.id() + "] references unknown block '" + blockId + "'");
                    continue;
                }
                String previous = owningStage.putIfAbsent(blockId, stage.id());
                if (previous != null) {
                    violations.add("block[" + blockId + "] belongs to stages " + previous + " and " + stage.id());
                }
            }
        }
        for (String blockId : blocks.keySet()) {
            if (!owningStage.containsKey(blockId)) {
                violations.add("block[" + blockId + "] belongs to no stage");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
