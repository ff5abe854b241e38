package com.github.salilvnair.funnelengine.action;

import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.entity.FeConversation;

/**
 * An irreversible external action that may fire at most once per conversation. Only ever
 * invoked by {@link com.github.salilvnair.funnelengine.guard.SideEffectGuard} after it won the
 * claim.
 */
public interface OneTimeAction {

    String key();

    ActionResult execute(FeConversation conversation, SideEffectRequest request);

    /**
     * Bookkeeping after a successful {@link #execute}. A failure here is logged by the guard and
     * never reverts the claim.
     */
    default void record(FeConversation conversation, ActionResult result) {
    }
}
