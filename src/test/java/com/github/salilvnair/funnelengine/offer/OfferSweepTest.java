package com.github.salilvnair.funnelengine.offer;

import com.github.salilvnair.funnelengine.action.AffiliateDmAction;
import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.batch.BatchReport;
import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.phase.TriggerStagePolicy;
import com.github.salilvnair.funnelengine.guard.SideEffectGuard;
import com.github.salilvnair.funnelengine.link.AffiliateLinkResolver;
import com.github.salilvnair.funnelengine.service.FunnelGraphRegistry;
import com.github.salilvnair.funnelengine.service.PublishedFunnel;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.spi.DeliveryReceipt;
import com.github.salilvnair.funnelengine.spi.MessageDelivery;
import com.github.salilvnair.funnelengine.store.InMemoryConversationStore;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import com.github.salilvnair.funnelengine.support.TestEngines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.github.salilvnair.funnelengine.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OfferSweepTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryConversationStore store = new InMemoryConversationStore();
    private final FunnelGraphRegistry registry = mock(FunnelGraphRegistry.class);
    private final MessageDelivery delivery = mock(MessageDelivery.class);
    private OfferSweep sweep;

    private final ExecutorService actionExecutor = Executors.newSingleThreadExecutor();

    @BeforeEach
    void setUp() {
        FunnelEngineConfig config = TestEngines.config();
        TestEngines.MapResourceDirectory directory = new TestEngines.MapResourceDirectory()
                .put(RESOURCE_AFFILIATE, SCOPE, AFFILIATE_RAW_LINK);
        AffiliateDmAction action = new AffiliateDmAction(
                new AffiliateLinkResolver(directory, config), delivery, store, config, clock);
        SideEffectGuard guard = new SideEffectGuard(store, List.of(action), actionExecutor, config, mock(AuditService.class), clock);
        sweep = new OfferSweep(store, registry, new TriggerStagePolicy(config), guard, config, clock);

        when(registry.graphFor(FUNNEL_ID)).thenReturn(new PublishedFunnel(FUNNEL_ID, 1, SCOPE, FunnelFixtures.nicheFunnel()));
        when(delivery.deliver(eq(USER_REF), anyString())).thenReturn(DeliveryReceipt.delivered());
    }

    @AfterEach
    void tearDown() {
        actionExecutor.shutdownNow();
    }

    @Test
    void settledOfferConversationGetsItsMessageOnce() {
        UUID id = store.create(FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset())).getConversationId();

        clock.advance(Duration.ofSeconds(10));
        assertEquals(0, sweep.sweep().affected());
        verifyNoInteractions(delivery);

        clock.advance(Duration.ofSeconds(20));
        BatchReport fired = sweep.sweep();
        BatchReport again = sweep.sweep();

        assertEquals(1, fired.affected());
        assertEquals(0, again.scanned());
        verify(delivery, times(1)).deliver(eq(USER_REF), contains(AFFILIATE_RAW_LINK));
        assertTrue(store.load(id).orElseThrow().isOneTimeActionClaimed());
        assertEquals(AFFILIATE_RAW_LINK, store.load(id).orElseThrow().resolvedLinkFor(RESOURCE_AFFILIATE));
    }

    @Test
    void conversationsOutsideTriggerStagesAreSkipped() {
        store.create(FunnelFixtures.conversationAt(BLOCK_TRANSITION, clock.nowOffset()));
        clock.advance(Duration.ofMinutes(5));

        BatchReport report = sweep.sweep();

        assertEquals(1, report.scanned());
        assertEquals(0, report.affected());
        verifyNoInteractions(delivery);
    }

    @Test
    void failedDeliveryIsReportedAndLeftUnclaimed() {
        UUID id = store.create(FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset())).getConversationId();
        clock.advance(Duration.ofMinutes(1));
        when(delivery.deliver(eq(USER_REF), anyString())).thenReturn(DeliveryReceipt.failed("blocked"));

        BatchReport report = sweep.sweep(ActiveConversationFilter.all().forFunnel(FUNNEL_ID));

        assertEquals("DELIVERY_FAILED", report.errors().get(0).errorCode());
        assertFalse(store.load(id).orElseThrow().isOneTimeActionClaimed());
    }

    @Test
    void orphanedConversationIsReportedWithoutStoppingTheSweep() {
        store.create(FunnelFixtures.conversationAt("ghost", clock.nowOffset()));
        UUID ok = store.create(FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset())).getConversationId();
        clock.advance(Duration.ofMinutes(1));

        BatchReport report = sweep.sweep();

        assertEquals(2, report.scanned());
        assertEquals(1, report.affected());
        assertEquals("ORPHANED_CONVERSATION", report.errors().get(0).errorCode());
        assertTrue(store.load(ok).orElseThrow().isOneTimeActionClaimed());
    }
}
