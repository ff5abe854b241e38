package com.github.salilvnair.funnelengine.engine.model;

import com.github.salilvnair.funnelengine.graph.model.BlockOption;

/**
 * @param number 1-based position of the option in its block
 */
public record MatchedOption(int number, BlockOption option) {
}
