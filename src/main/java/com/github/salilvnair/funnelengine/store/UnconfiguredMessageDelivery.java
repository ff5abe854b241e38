package com.github.salilvnair.funnelengine.store;

import com.github.salilvnair.funnelengine.spi.DeliveryReceipt;
import com.github.salilvnair.funnelengine.spi.MessageDelivery;
import lombok.extern.slf4j.Slf4j;

/**
 * Stand-in used until the host registers a real {@link MessageDelivery}. Every delivery
 * fails, so one-time actions are released instead of being marked as sent.
 */
@Slf4j
public class UnconfiguredMessageDelivery implements MessageDelivery {

    @Override
    public DeliveryReceipt deliver(String targetUserRef, String text) {
        log.warn("No MessageDelivery bean configured; dropping message for user {}", targetUserRef);
        return DeliveryReceipt.failed("no message delivery transport configured");
    }
}
