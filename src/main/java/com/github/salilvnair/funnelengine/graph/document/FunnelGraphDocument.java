package com.github.salilvnair.funnelengine.graph.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Wire shape of a published funnel: {@code {startBlockId, stages[], blocks{}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunnelGraphDocument(String startBlockId, List<Stage> stages, Map<String, Block> blocks) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stage(String id, String name, String explanation, List<String> blockIds) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Block(String id, String message, List<Option> options, String resourceName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Option(String text, String nextBlockId) {
    }
}
