package com.github.salilvnair.funnelengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "funnelengine")
@Getter
@Setter
public class FunnelEngineConfig {

    private Graph graph = new Graph();
    private Matching matching = new Matching();
    private Link link = new Link();
    private Guard guard = new Guard();
    private Lifecycle lifecycle = new Lifecycle();
    private RePrompt reprompt = new RePrompt();
    private Affiliate affiliate = new Affiliate();
    private Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Graph {
        private List<String> triggerStages = new ArrayList<>(List.of("OFFER"));
    }

    @Getter
    @Setter
    public static class Matching {
        private boolean trim = true;
        private boolean collapseWhitespace = true;
        private boolean numericIndex = true;
    }

    @Getter
    @Setter
    public static class Link {
        private String placeholder = "[LINK]";
        private String attributionParam = "app";
        /**
         * Blank means the conversation's scope is used.
         */
        private String attributionValue = "";
        private List<String> attributionKeys = new ArrayList<>(List.of("app", "ref"));
        private String fallbackUrl = "https://whop.com/apps";
    }

    @Getter
    @Setter
    public static class Guard {
        private Duration actionTimeout = Duration.ofSeconds(30);
        private Duration offerSettleTime = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Lifecycle {
        private Duration inactivityThreshold = Duration.ofDays(2);
    }

    @Getter
    @Setter
    public static class RePrompt {
        private List<String> phase1Stages = new ArrayList<>(List.of("WELCOME"));
        private List<String> phase2Stages = new ArrayList<>(List.of("VALUE_DELIVERY"));
        private List<Integer> phase1Offsets = new ArrayList<>(List.of(10, 60, 720));
        private List<Integer> phase2Offsets = new ArrayList<>(List.of(15, 60, 720));
        private Map<String, Map<Integer, String>> messages = defaultMessages();

        private static Map<String, Map<Integer, String>> defaultMessages() {
            Map<Integer, String> phase1 = new LinkedHashMap<>();
            phase1.put(10, "Hey, what's your niche? Reply 1 for E-commerce, etc.");
            phase1.put(60, "Missed you! Reply with a number for free value.");
            phase1.put(720, "Still interested? Reply for your free resource!");
            Map<Integer, String> phase2 = new LinkedHashMap<>();
            phase2.put(15, "Reply 'done' when you've checked the value!");
            phase2.put(60, "All set? Say 'done' for the next step!");
            phase2.put(720, "Still with us? Reply 'done' for private chat!");
            Map<String, Map<Integer, String>> defaults = new LinkedHashMap<>();
            defaults.put("PHASE1", phase1);
            defaults.put("PHASE2", phase2);
            return defaults;
        }
    }

    @Getter
    @Setter
    public static class Affiliate {
        private String messageTemplate = "Glad you're here! Here is your exclusive link: {affiliateLink}\n"
                + "Install the app to keep everything in one place: {appInstallLink}";
        private String appInstallUrl = "https://whop.com/apps";
    }

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = false;
        private Duration repromptInterval = Duration.ofSeconds(30);
        private Duration reaperInterval = Duration.ofHours(1);
        private Duration offerSweepInterval = Duration.ofSeconds(30);
    }
}
