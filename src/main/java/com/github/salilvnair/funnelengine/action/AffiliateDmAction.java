package com.github.salilvnair.funnelengine.action;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.link.LinkResolver;
import com.github.salilvnair.funnelengine.link.LinkSource;
import com.github.salilvnair.funnelengine.link.ResolvedLink;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import com.github.salilvnair.funnelengine.spi.DeliveryReceipt;
import com.github.salilvnair.funnelengine.spi.MessageDelivery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;

/**
 * Sends the one-time affiliate direct message when a conversation reaches the offer stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AffiliateDmAction implements OneTimeAction {

    public static final String ACTION_KEY = "AFFILIATE_DM";

    static final String AFFILIATE_LINK_TOKEN = "{affiliateLink}";
    static final String APP_INSTALL_LINK_TOKEN = "{appInstallLink}";

    private final LinkResolver linkResolver;
    private final MessageDelivery messageDelivery;
    private final ConversationStore conversationStore;
    private final FunnelEngineConfig config;
    private final Clock clock;

    @Override
    public String key() {
        return ACTION_KEY;
    }

    @Override
    public ActionResult execute(FeConversation conversation, SideEffectRequest request) {
        String link = stableLink(conversation, request.resourceName());
        String text = config.getAffiliate().getMessageTemplate()
                .replace(AFFILIATE_LINK_TOKEN, link)
                .replace(APP_INSTALL_LINK_TOKEN, config.getAffiliate().getAppInstallUrl());
        DeliveryReceipt receipt = messageDelivery.deliver(conversation.getTargetUserRef(), text);
        return new ActionResult(receipt, text);
    }

    @Override
    public void record(FeConversation conversation, ActionResult result) {
        conversationStore.appendMessage(conversation.getConversationId(), MessageRole.BOT,
                result.content(), OffsetDateTime.now(clock));
    }

    /**
     * Persists a freshly resolved link before it is sent, so the DM and every later render
     * show the same URL. If another writer stored one first, that one wins.
     */
    private String stableLink(FeConversation conversation, String resourceName) {
        ResolvedLink resolved = linkResolver.resolve(resourceName, conversation);
        if (resolved.source() != LinkSource.DIRECTORY) {
            return resolved.url();
        }
        int stored = conversationStore.casUpdate(conversation.getConversationId(),
                c -> c.resolvedLinkFor(resourceName) == null,
                c -> {
                    if (c.getResolvedLinks() == null) {
                        c.setResolvedLinks(new LinkedHashMap<>());
                    }
                    c.getResolvedLinks().put(resourceName, resolved.url());
                });
        if (stored == 1) {
            return resolved.url();
        }
        return conversationStore.load(conversation.getConversationId())
                .map(c -> c.resolvedLinkFor(resourceName))
                .orElse(resolved.url());
    }
}
