package com.github.salilvnair.funnelengine.batch;

import java.util.UUID;

public record BatchItemError(UUID conversationId, String errorCode, String message) {
}
