package com.github.salilvnair.funnelengine.link;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.spi.FunnelResource;
import com.github.salilvnair.funnelengine.spi.ResourceDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class AffiliateLinkResolver implements LinkResolver {

    private final ResourceDirectory resourceDirectory;
    private final FunnelEngineConfig config;

    @Override
    public ResolvedLink resolve(String resourceName, FeConversation conversation) {
        String cached = conversation.resolvedLinkFor(resourceName);
        if (cached != null && !cached.isBlank()) {
            return new ResolvedLink(cached, LinkSource.CACHED);
        }

        Optional<FunnelResource> resource = resourceName == null || resourceName.isBlank()
                ? Optional.empty()
                : resourceDirectory.findResource(resourceName, conversation.getScope());
        if (resource.isPresent() && resource.get().link() != null && !resource.get().link().isBlank()) {
            String tagged = withAttribution(resource.get().link().trim(), attributionValue(conversation));
            if (conversation.getResolvedLinks() == null) {
                conversation.setResolvedLinks(new LinkedHashMap<>());
            }
            conversation.getResolvedLinks().put(resourceName, tagged);
            log.debug("Resolved resource {} for convId={} -> {}", resourceName, conversation.getConversationId(), tagged);
            return new ResolvedLink(tagged, LinkSource.DIRECTORY);
        }

        log.warn("Resource {} not found in scope {} for convId={}, using fallback link",
                resourceName, conversation.getScope(), conversation.getConversationId());
        return new ResolvedLink(fallbackUrl(), LinkSource.FALLBACK);
    }

    @Override
    public String fallbackUrl() {
        return config.getLink().getFallbackUrl();
    }

    String withAttribution(String rawLink, String value) {
        if (value == null || value.isBlank() || hasAttribution(rawLink)) {
            return rawLink;
        }
        return UriComponentsBuilder.fromUriString(rawLink)
                .queryParam(config.getLink().getAttributionParam(), value)
                .build()
                .toUriString();
    }

    boolean hasAttribution(String rawLink) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUriString(rawLink).build().getQueryParams();
        return params.keySet().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .anyMatch(k -> config.getLink().getAttributionKeys().stream()
                        .anyMatch(a -> a.equalsIgnoreCase(k)));
    }

    private String attributionValue(FeConversation conversation) {
        String configured = config.getLink().getAttributionValue();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return conversation.getScope() != null && !conversation.getScope().isBlank()
                ? conversation.getScope()
                : conversation.getFunnelId();
    }
}
