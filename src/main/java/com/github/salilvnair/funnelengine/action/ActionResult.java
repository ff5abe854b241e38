package com.github.salilvnair.funnelengine.action;

import com.github.salilvnair.funnelengine.spi.DeliveryReceipt;

/**
 * @param content text that was (or was attempted to be) delivered
 */
public record ActionResult(DeliveryReceipt receipt, String content) {

    public boolean succeeded() {
        return receipt != null && receipt.success();
    }

    public static ActionResult failed(String error) {
        return new ActionResult(DeliveryReceipt.failed(error), null);
    }
}
