package com.github.salilvnair.funnelengine.service;

import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;

public record PublishedFunnel(String funnelId, Integer version, String scope, FunnelGraph graph) {
}
