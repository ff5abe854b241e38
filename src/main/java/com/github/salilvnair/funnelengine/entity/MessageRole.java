package com.github.salilvnair.funnelengine.entity;

public enum MessageRole {
    USER,
    BOT,
    SYSTEM
}
