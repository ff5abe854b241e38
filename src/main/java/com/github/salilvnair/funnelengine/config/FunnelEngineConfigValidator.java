package com.github.salilvnair.funnelengine.config;

import com.github.salilvnair.funnelengine.engine.phase.FunnelPhase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class FunnelEngineConfigValidator {

    private final FunnelEngineConfig config;

    public void validateOrThrow() {
        List<String> violations = new ArrayList<>();
        FunnelEngineConfig.RePrompt reprompt = config.getReprompt();
        validateOffsets(FunnelPhase.PHASE1, reprompt.getPhase1Offsets(), reprompt.getMessages(), violations);
        validateOffsets(FunnelPhase.PHASE2, reprompt.getPhase2Offsets(), reprompt.getMessages(), violations);

        validatePositive("funnelengine.lifecycle.inactivity-threshold", config.getLifecycle().getInactivityThreshold(), violations);
        validatePositive("funnelengine.guard.action-timeout", config.getGuard().getActionTimeout(), violations);
        if (config.getGuard().getOfferSettleTime() == null || config.getGuard().getOfferSettleTime().isNegative()) {
            violations.add("funnelengine.guard.offer-settle-time must not be negative");
        }
        if (config.getGraph().getTriggerStages() == null || config.getGraph().getTriggerStages().isEmpty()) {
            violations.add("funnelengine.graph.trigger-stages must name at least one stage");
        }
        String placeholder = config.getLink().getPlaceholder();
        if (placeholder == null || placeholder.isEmpty()) {
            violations.add("funnelengine.link.placeholder is blank");
        }

        if (!violations.isEmpty()) {
            throw new IllegalStateException(
                    "FunnelEngine configuration validation failed. Violations: " + String.join(" | ", violations));
        }
    }

    private void validateOffsets(FunnelPhase phase,
                                 List<Integer> offsets,
                                 Map<String, Map<Integer, String>> messages,
                                 List<String> violations) {
        if (offsets == null || offsets.isEmpty()) {
            violations.add("reprompt " + phase + " has no offsets");
            return;
        }
        Map<Integer, String> byOffset = messages == null ? null : messages.get(phase.name());
        for (Integer offset : offsets) {
            if (offset == null || offset <= 0) {
                violations.add("reprompt " + phase + " offset " + offset + " must be positive");
                continue;
            }
            String message = byOffset == null ? null : byOffset.get(offset);
            if (message == null || message.isBlank()) {
                violations.add("reprompt " + phase + " offset " + offset + " has no message");
            }
        }
    }

    private void validatePositive(String key, Duration value, List<String> violations) {
        if (value == null || value.isZero() || value.isNegative()) {
            violations.add(key + " must be positive");
        }
    }
}
