package com.github.salilvnair.funnelengine.link;

public record ResolvedLink(String url, LinkSource source) {

    public boolean isFallback() {
        return source == LinkSource.FALLBACK;
    }
}
