package com.github.salilvnair.funnelengine.engine.model;

import java.util.UUID;

/**
 * Ask the caller to run a one-time action through the side-effect guard. The engine never
 * runs it itself.
 */
public record SideEffectRequest(UUID conversationId, String actionKey, String blockId, String resourceName) {
}
