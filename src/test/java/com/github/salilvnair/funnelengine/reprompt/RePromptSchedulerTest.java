package com.github.salilvnair.funnelengine.reprompt;

import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.phase.FunnelPhase;
import com.github.salilvnair.funnelengine.engine.phase.PhaseDetector;
import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.graph.model.FunnelGraph;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import com.github.salilvnair.funnelengine.support.TestEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.Optional;

import static com.github.salilvnair.funnelengine.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class RePromptSchedulerTest {

    private final MutableClock clock = new MutableClock();
    private final FunnelGraph graph = FunnelFixtures.nicheFunnel();
    private FunnelEngineConfig config;
    private RePromptScheduler scheduler;
    private OffsetDateTime start;

    @BeforeEach
    void setUp() {
        config = TestEngines.config();
        scheduler = new RePromptScheduler(config, new PhaseDetector(config), clock);
        start = clock.nowOffset();
    }

    @Test
    void phaseOneNudgeIsDueOnlyInItsExactMinute() {
        FeConversation conversation = FunnelFixtures.conversationAt(BLOCK_WELCOME, start);

        assertTrue(scheduler.dueRePrompt(conversation, graph, start).isEmpty());
        assertTrue(scheduler.dueRePrompt(conversation, graph, start.plusMinutes(9).plusSeconds(59)).isEmpty());
        assertTrue(scheduler.dueRePrompt(conversation, graph, start.plusMinutes(11)).isEmpty());

        RePromptDue due = scheduler.dueRePrompt(conversation, graph, start.plusMinutes(10)).orElseThrow();
        assertEquals(FunnelPhase.PHASE1, due.phase());
        assertEquals(10, due.offsetMinutes());
        assertEquals("PHASE1:10", due.key());
        assertEquals(config.getReprompt().getMessages().get("PHASE1").get(10), due.message());
        assertEquals(Optional.of(due), scheduler.dueRePrompt(conversation, graph, start.plusMinutes(10).plusSeconds(59)));
    }

    @Test
    void phaseTwoIsAnchoredOnPhaseStartTime() {
        FeConversation conversation = FunnelFixtures.conversationAt(BLOCK_VALUE_COACH, start);
        conversation.setPhaseStartTime(start.plusHours(1));

        assertTrue(scheduler.dueRePrompt(conversation, graph, start.plusMinutes(15)).isEmpty());
        RePromptDue due = scheduler.dueRePrompt(conversation, graph, start.plusHours(1).plusMinutes(15)).orElseThrow();
        assertEquals("PHASE2:15", due.key());
    }

    @Test
    void phaseTwoWithoutAnchorIsNeverDue() {
        FeConversation conversation = FunnelFixtures.conversationAt(BLOCK_VALUE_ECOM, start);

        assertTrue(scheduler.dueRePrompt(conversation, graph, start.plusMinutes(15)).isEmpty());
    }

    @Test
    void transitionOfferAndClosedConversationsAreNotNudged() {
        FeConversation atTransition = FunnelFixtures.conversationAt(BLOCK_TRANSITION, start);
        FeConversation atOffer = FunnelFixtures.conversationAt(BLOCK_OFFER, start);
        FeConversation closed = FunnelFixtures.conversationAt(BLOCK_WELCOME, start);
        closed.setStatus(ConversationStatus.CLOSED);

        assertTrue(scheduler.dueRePrompt(atTransition, graph, start.plusMinutes(10)).isEmpty());
        assertTrue(scheduler.dueRePrompt(atOffer, graph, start.plusMinutes(10)).isEmpty());
        assertTrue(scheduler.dueRePrompt(closed, graph, start.plusMinutes(10)).isEmpty());
    }

    @Test
    void clockBehindAnchorIsNotDue() {
        FeConversation conversation = FunnelFixtures.conversationAt(BLOCK_WELCOME, start.plusMinutes(10));

        assertTrue(scheduler.dueRePrompt(conversation, graph, start).isEmpty());
    }

    @Test
    void missingMessageIsReported() {
        config.getReprompt().getMessages().get("PHASE1").remove(60);
        FeConversation conversation = FunnelFixtures.conversationAt(BLOCK_WELCOME, start);

        FunnelEngineException ex = assertThrows(FunnelEngineException.class,
                () -> scheduler.dueRePrompt(conversation, graph, start.plusMinutes(60)));

        assertTrue(ex.is(FunnelEngineErrorCode.REPROMPT_MESSAGE_MISSING));
    }
}
