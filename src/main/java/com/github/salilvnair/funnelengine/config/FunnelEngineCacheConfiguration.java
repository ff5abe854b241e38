package com.github.salilvnair.funnelengine.config;

import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
public class FunnelEngineCacheConfiguration {
    // Imported by @EnableFunnelEngineCaching so published graphs are parsed once per funnel.
}
