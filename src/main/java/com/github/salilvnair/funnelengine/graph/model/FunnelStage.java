package com.github.salilvnair.funnelengine.graph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record FunnelStage(String id, String name, String explanation, List<String> blockIds) {

    public FunnelStage {
        blockIds = blockIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(blockIds));
    }
}
