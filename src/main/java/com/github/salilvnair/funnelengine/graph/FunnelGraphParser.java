package com.github.salilvnair.funnelengine.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.salilvnair.funnelengine.engine.exception.GraphIntegrityException;
import com.github.salilvnair.funnelengine.graph.document.FunnelGraphDocument;
import com.github.salilvnair.funnelengine.graph.model.BlockOption;
import com.github.salilvnair.funnelengine.graph.model.FunnelBlock;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import com.github.salilvnair.funnelengine.graph.model.FunnelStage;
import com.github.salilvnair.funnelengine.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class FunnelGraphParser {

    public FunnelGraph parse(String flowJson) {
        if (flowJson == null || flowJson.isBlank()) {
            throw new GraphIntegrityException(List.of("funnel graph document is empty"));
        }
        FunnelGraphDocument document;
        try {
            document = JsonUtil.mapper().readValue(flowJson, FunnelGraphDocument.class);
        }
        catch (JsonProcessingException e) {
            throw new GraphIntegrityException("funnel graph document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return toGraph(document);
    }

    public FunnelGraph toGraph(FunnelGraphDocument document) {
        if (document == null) {
            throw new GraphIntegrityException(List.of("funnel graph document is empty"));
        }
        List<FunnelStage> stages = document.stages() == null ? List.of() : document.stages().stream()
                .map(s -> s == null ? null : new FunnelStage(s.id(), s.name(), s.explanation(), s.blockIds()))
                .toList();

        Map<String, FunnelBlock> blocks = new LinkedHashMap<>();
        if (document.blocks() != null) {
            document.blocks().forEach((key, b) -> blocks.put(key, b == null ? null : toBlock(key, b)));
        }
        return FunnelGraph.of(document.startBlockId(), stages, blocks);
    }

    private FunnelBlock toBlock(String key, FunnelGraphDocument.Block block) {
        List<BlockOption> options = block.options() == null ? List.of() : block.options().stream()
                .map(o -> o == null ? null : new BlockOption(o.text(), blankToNull(o.nextBlockId())))
                .toList();
        String id = block.id() == null ? key : block.id();
        return new FunnelBlock(id, block.message(), options, blankToNull(block.resourceName()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
