package com.github.salilvnair.funnelengine.link;

public enum LinkSource {
    CACHED,
    DIRECTORY,
    FALLBACK
}
