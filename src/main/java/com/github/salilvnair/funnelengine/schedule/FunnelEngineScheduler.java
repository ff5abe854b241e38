package com.github.salilvnair.funnelengine.schedule;

import com.github.salilvnair.funnelengine.lifecycle.InactivityReaper;
import com.github.salilvnair.funnelengine.offer.OfferSweep;
import com.github.salilvnair.funnelengine.reprompt.RePromptDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional in-process host for the batches. Disabled unless
 * {@code funnelengine.schedule.enabled=true}; an external cron can call the maintenance
 * endpoints instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "funnelengine.schedule", name = "enabled", havingValue = "true")
public class FunnelEngineScheduler {

    private final RePromptDispatcher rePromptDispatcher;
    private final InactivityReaper inactivityReaper;
    private final OfferSweep offerSweep;

    @Scheduled(fixedDelayString = "${funnelengine.schedule.reprompt-interval:PT30S}")
    public void rePrompt() {
        rePromptDispatcher.dispatch();
    }

    @Scheduled(fixedDelayString = "${funnelengine.schedule.offer-sweep-interval:PT30S}")
    public void offerSweep() {
        offerSweep.sweep();
    }

    @Scheduled(fixedDelayString = "${funnelengine.schedule.reaper-interval:PT1H}")
    public void reap() {
        inactivityReaper.reap();
    }
}
