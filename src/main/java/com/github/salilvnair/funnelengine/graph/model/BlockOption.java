package com.github.salilvnair.funnelengine.graph.model;

/**
 * One outgoing choice of a block. A {@code null} {@code nextBlockId} is a terminal option.
 */
public record BlockOption(String text, String nextBlockId) {

    public boolean isTerminal() {
        return nextBlockId == null;
    }
}
