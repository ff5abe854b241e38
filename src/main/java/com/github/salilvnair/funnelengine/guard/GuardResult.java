package com.github.salilvnair.funnelengine.guard;

import java.util.UUID;

public record GuardResult(UUID conversationId, String actionKey, GuardOutcome outcome, String error) {
}
