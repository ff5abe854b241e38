package com.github.salilvnair.funnelengine.spi;

public record FunnelResource(String name, String link, String category) {
}
