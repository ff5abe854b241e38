package com.github.salilvnair.funnelengine.api.controller;

import com.github.salilvnair.funnelengine.api.dto.BatchRunResponse;
import com.github.salilvnair.funnelengine.lifecycle.InactivityReaper;
import com.github.salilvnair.funnelengine.offer.OfferSweep;
import com.github.salilvnair.funnelengine.reprompt.RePromptDispatcher;
import com.github.salilvnair.funnelengine.service.FunnelGraphRegistry;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Lets an external cron drive the batches.
 */
@RestController
@RequestMapping("/api/v1/funnel/maintenance")
@RequiredArgsConstructor
public class FunnelMaintenanceController {

    private final InactivityReaper inactivityReaper;
    private final RePromptDispatcher rePromptDispatcher;
    private final OfferSweep offerSweep;
    private final FunnelGraphRegistry graphRegistry;

    @PostMapping("/reap")
    public BatchRunResponse reap(@RequestParam(value = "funnelId", required = false) String funnelId) {
        return BatchRunResponse.of(inactivityReaper.reap(ActiveConversationFilter.all().forFunnel(funnelId)));
    }

    @PostMapping("/reprompt")
    public BatchRunResponse reprompt(@RequestParam(value = "funnelId", required = false) String funnelId) {
        return BatchRunResponse.of(rePromptDispatcher.dispatch(ActiveConversationFilter.all().forFunnel(funnelId)));
    }

    @PostMapping("/offer-sweep")
    public BatchRunResponse offerSweep(@RequestParam(value = "funnelId", required = false) String funnelId) {
        return BatchRunResponse.of(offerSweep.sweep(ActiveConversationFilter.unclaimed().forFunnel(funnelId)));
    }

    @PostMapping("/graphs/{funnelId}/evict")
    public Map<String, Object> evictGraph(@PathVariable("funnelId") String funnelId) {
        graphRegistry.evict(funnelId);
        return Map.of("success", true, "funnelId", funnelId);
    }
}
