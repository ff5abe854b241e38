package com.github.salilvnair.funnelengine.spi;

public record DeliveryReceipt(boolean success, String error) {

    public static DeliveryReceipt delivered() {
        return new DeliveryReceipt(true, null);
    }

    public static DeliveryReceipt failed(String error) {
        return new DeliveryReceipt(false, error == null || error.isBlank() ? "delivery failed" : error);
    }
}
