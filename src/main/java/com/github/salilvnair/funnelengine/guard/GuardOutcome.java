package com.github.salilvnair.funnelengine.guard;

public enum GuardOutcome {
    /** Claim won and the action succeeded. */
    FIRED,
    /** Claim won, action succeeded, but bookkeeping afterwards failed. The claim stands. */
    FIRED_BOOKKEEPING_FAILED,
    /** Someone else holds the claim; success as a no-op. */
    CLAIM_LOST,
    /** Claim won but the action failed; the claim was released for a retry. */
    RELEASED_AFTER_FAILURE,
    /** The action outlived the timeout. The claim is held until it returns, then kept or released. */
    IN_FLIGHT_AFTER_TIMEOUT;

    public boolean fired() {
        return this == FIRED || this == FIRED_BOOKKEEPING_FAILED;
    }
}
