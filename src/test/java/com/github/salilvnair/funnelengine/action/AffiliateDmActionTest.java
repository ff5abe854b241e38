package com.github.salilvnair.funnelengine.action;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.link.AffiliateLinkResolver;
import com.github.salilvnair.funnelengine.spi.DeliveryReceipt;
import com.github.salilvnair.funnelengine.spi.MessageDelivery;
import com.github.salilvnair.funnelengine.store.InMemoryConversationStore;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import com.github.salilvnair.funnelengine.support.TestEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.funnelengine.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AffiliateDmActionTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryConversationStore store = new InMemoryConversationStore();
    private final MessageDelivery delivery = mock(MessageDelivery.class);
    private final TestEngines.MapResourceDirectory directory = new TestEngines.MapResourceDirectory();
    private FunnelEngineConfig config;
    private AffiliateDmAction action;
    private FeConversation conversation;

    @BeforeEach
    void setUp() {
        config = TestEngines.config();
        config.getAffiliate().setMessageTemplate("Link: {affiliateLink} | App: {appInstallLink}");
        config.getAffiliate().setAppInstallUrl("https://whop.com/apps/install");
        action = new AffiliateDmAction(new AffiliateLinkResolver(directory, config), delivery, store, config, clock);
        conversation = store.create(FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset()));
        when(delivery.deliver(eq(USER_REF), anyString())).thenReturn(DeliveryReceipt.delivered());
    }

    @Test
    void sendsTemplatedMessageAndPersistsTheLink() {
        directory.put(RESOURCE_AFFILIATE, SCOPE, AFFILIATE_RAW_LINK);

        ActionResult result = action.execute(conversation, request());

        String expected = "Link: " + AFFILIATE_RAW_LINK + " | App: https://whop.com/apps/install";
        assertTrue(result.succeeded());
        assertEquals(expected, result.content());
        verify(delivery).deliver(USER_REF, expected);
        assertEquals(AFFILIATE_RAW_LINK, store.load(conversation.getConversationId()).orElseThrow()
                .resolvedLinkFor(RESOURCE_AFFILIATE));
    }

    @Test
    void linkStoredByAnotherWriterWins() {
        directory.put(RESOURCE_AFFILIATE, SCOPE, AFFILIATE_RAW_LINK);
        store.casUpdate(conversation.getConversationId(), c -> true,
                c -> c.getResolvedLinks().put(RESOURCE_AFFILIATE, "https://whop.com/first?ref=a"));

        ActionResult result = action.execute(conversation, request());

        assertTrue(result.content().contains("https://whop.com/first?ref=a"));
    }

    @Test
    void fallbackLinkIsSentButNotPersisted() {
        ActionResult result = action.execute(conversation, request());

        assertTrue(result.content().contains(FALLBACK_URL));
        assertNull(store.load(conversation.getConversationId()).orElseThrow().resolvedLinkFor(RESOURCE_AFFILIATE));
    }

    @Test
    void failedDeliveryIsReturnedNotThrown() {
        when(delivery.deliver(eq(USER_REF), anyString())).thenReturn(DeliveryReceipt.failed("blocked"));

        ActionResult result = action.execute(conversation, request());

        assertFalse(result.succeeded());
        assertEquals("blocked", result.receipt().error());
    }

    @Test
    void recordAppendsBotMessage() {
        action.record(conversation, new ActionResult(DeliveryReceipt.delivered(), "sent text"));

        assertEquals(1, store.messages(conversation.getConversationId()).size());
        assertEquals(MessageRole.BOT, store.messages(conversation.getConversationId()).get(0).getRole());
        assertEquals("sent text", store.messages(conversation.getConversationId()).get(0).getContent());
    }

    private SideEffectRequest request() {
        return new SideEffectRequest(conversation.getConversationId(), AffiliateDmAction.ACTION_KEY,
                BLOCK_OFFER, RESOURCE_AFFILIATE);
    }
}
