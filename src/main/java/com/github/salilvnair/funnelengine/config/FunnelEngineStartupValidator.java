package com.github.salilvnair.funnelengine.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class FunnelEngineStartupValidator {

    private final FunnelEngineConfigValidator configValidator;

    @EventListener(ApplicationReadyEvent.class)
    public void validate() {
        log.info("FunnelEngine: validating configuration.");
        configValidator.validateOrThrow();
        log.info("FunnelEngine: configuration valid.");
    }
}
