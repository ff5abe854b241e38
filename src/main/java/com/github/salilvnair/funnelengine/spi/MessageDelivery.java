package com.github.salilvnair.funnelengine.spi;

/**
 * Transport collaborator that actually sends a direct message. Fire-and-observe: retries
 * are the transport's business, the engine only looks at the receipt.
 */
@FunctionalInterface
public interface MessageDelivery {

    DeliveryReceipt deliver(String targetUserRef, String text);
}
