package com.github.salilvnair.funnelengine.spi;

/**
 * Narrows {@link ConversationStore#listActive}. {@code null} fields do not filter.
 */
public record ActiveConversationFilter(String funnelId, String scope, boolean unclaimedOnly) {

    public static ActiveConversationFilter all() {
        return new ActiveConversationFilter(null, null, false);
    }

    public static ActiveConversationFilter unclaimed() {
        return new ActiveConversationFilter(null, null, true);
    }

    public ActiveConversationFilter forFunnel(String funnelId) {
        return new ActiveConversationFilter(funnelId, scope, unclaimedOnly);
    }

    public ActiveConversationFilter forScope(String scope) {
        return new ActiveConversationFilter(funnelId, scope, unclaimedOnly);
    }
}
