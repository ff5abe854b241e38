package com.github.salilvnair.funnelengine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "funnelengine.schedule", name = "enabled", havingValue = "true")
@EnableScheduling
public class FunnelEngineSchedulingConfiguration {
}
