package com.github.salilvnair.funnelengine.entity;

public enum ConversationStatus {
    ACTIVE,
    CLOSED
}
