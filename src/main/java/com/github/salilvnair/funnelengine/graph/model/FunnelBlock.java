package com.github.salilvnair.funnelengine.graph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record FunnelBlock(String id, String message, List<BlockOption> options, String resourceName) {

    public FunnelBlock {
        options = options == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(options));
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }

    public boolean hasResource() {
        return resourceName != null && !resourceName.isBlank();
    }
}
