package com.github.salilvnair.funnelengine.store;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.FeMessage;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.github.salilvnair.funnelengine.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryConversationStoreTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryConversationStore store = new InMemoryConversationStore();

    @Test
    void casUpdateAppliesOnlyWhenPredicateHolds() {
        FeConversation created = store.create(FunnelFixtures.conversationAt(BLOCK_WELCOME, clock.nowOffset()));
        UUID id = created.getConversationId();

        int missed = store.casUpdate(id, c -> BLOCK_OFFER.equals(c.getCurrentBlockId()), c -> c.setCurrentBlockId("x"));
        int applied = store.casUpdate(id, c -> BLOCK_WELCOME.equals(c.getCurrentBlockId()),
                c -> c.setCurrentBlockId(BLOCK_VALUE_ECOM));

        assertEquals(0, missed);
        assertEquals(1, applied);
        FeConversation loaded = store.load(id).orElseThrow();
        assertEquals(BLOCK_VALUE_ECOM, loaded.getCurrentBlockId());
        assertEquals(1L, loaded.getVersion());
        assertEquals(0, store.casUpdate(UUID.randomUUID(), c -> true, c -> { }));
    }

    @Test
    void loadedRecordsAreDetachedCopies() {
        FeConversation created = store.create(FunnelFixtures.conversationAt(BLOCK_WELCOME, clock.nowOffset()));

        FeConversation loaded = store.load(created.getConversationId()).orElseThrow();
        loaded.setCurrentBlockId(BLOCK_OFFER);
        loaded.getUserPath().add("sneaky");

        FeConversation again = store.load(created.getConversationId()).orElseThrow();
        assertEquals(BLOCK_WELCOME, again.getCurrentBlockId());
        assertTrue(again.getUserPath().isEmpty());
    }

    @Test
    void duplicateCreateIsRefused() {
        FeConversation conversation = FunnelFixtures.conversationAt(BLOCK_WELCOME, clock.nowOffset());
        store.create(conversation);

        FunnelEngineException ex = assertThrows(FunnelEngineException.class, () -> store.create(conversation));

        assertTrue(ex.is(FunnelEngineErrorCode.CONVERSATION_PERSIST_FAILED));
    }

    @Test
    void claimIsGrantedOnceUntilReleased() {
        UUID id = store.create(FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset())).getConversationId();

        assertTrue(store.claimOneTimeAction(id, clock.nowOffset()));
        assertFalse(store.claimOneTimeAction(id, clock.nowOffset()));
        assertTrue(store.releaseOneTimeAction(id, clock.nowOffset()));
        assertFalse(store.releaseOneTimeAction(id, clock.nowOffset()));
        assertTrue(store.claimOneTimeAction(id, clock.nowOffset()));
    }

    @Test
    void listActiveFiltersAndOrdersByCreation() {
        FeConversation older = store.create(FunnelFixtures.conversationAt(BLOCK_WELCOME, clock.nowOffset()));
        clock.advance(Duration.ofMinutes(1));
        FeConversation newer = store.create(FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset()));
        clock.advance(Duration.ofMinutes(1));
        FeConversation closed = FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset());
        closed.setStatus(ConversationStatus.CLOSED);
        store.create(closed);
        FeConversation otherFunnel = FunnelFixtures.conversationAt(BLOCK_OFFER, clock.nowOffset());
        otherFunnel.setFunnelId("other");
        store.create(otherFunnel);
        store.claimOneTimeAction(newer.getConversationId(), clock.nowOffset());

        List<UUID> all = ids(store.listActive(ActiveConversationFilter.all().forFunnel(FUNNEL_ID)));
        List<UUID> unclaimed = ids(store.listActive(ActiveConversationFilter.unclaimed().forFunnel(FUNNEL_ID)));

        assertEquals(List.of(older.getConversationId(), newer.getConversationId()), all);
        assertEquals(List.of(older.getConversationId()), unclaimed);
        assertEquals(3, store.listActive(null).size());
        assertTrue(store.listActive(ActiveConversationFilter.all().forScope("nope")).isEmpty());
    }

    @Test
    void appendMessageMovesLastActivityForwardOnly() {
        UUID id = store.create(FunnelFixtures.conversationAt(BLOCK_WELCOME, clock.nowOffset())).getConversationId();
        clock.advance(Duration.ofMinutes(5));

        store.appendMessage(id, MessageRole.USER, INPUT_ONE, clock.nowOffset());
        store.appendMessage(id, MessageRole.BOT, "late echo", clock.nowOffset().minusMinutes(1));

        assertEquals(clock.nowOffset(), store.load(id).orElseThrow().getLastMessageAt());
        assertEquals(List.of(MessageRole.USER, MessageRole.BOT),
                store.messages(id).stream().map(FeMessage::getRole).toList());
    }

    private static List<UUID> ids(List<FeConversation> conversations) {
        return conversations.stream().map(FeConversation::getConversationId).toList();
    }
}
