package com.github.salilvnair.funnelengine.engine.model;

import java.time.OffsetDateTime;

/**
 * One accepted input: the block it was answered at, the option it selected (1-based, or
 * {@code null} when the block had no options) and where it led.
 */
public record FunnelInteraction(
        String blockId,
        Integer optionNumber,
        String optionChosen,
        String rawInput,
        String nextBlockId,
        OffsetDateTime timestamp
) {}
