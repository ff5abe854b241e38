package com.github.salilvnair.funnelengine.batch;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.support.FunnelFixtures;
import com.github.salilvnair.funnelengine.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.funnelengine.support.TestConstants.BLOCK_WELCOME;
import static org.junit.jupiter.api.Assertions.*;

class BatchRunTest {

    private final MutableClock clock = new MutableClock();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void oneFailingItemDoesNotStopTheOthers() {
        FeConversation ok = conversation();
        FeConversation known = conversation();
        FeConversation unknown = conversation();
        FeConversation untouched = conversation();

        BatchReport report = BatchRun.over("test", List.of(ok, known, unknown, untouched), c -> {
            if (c == known) {
                throw new FunnelEngineException(FunnelEngineErrorCode.DELIVERY_FAILED, "transport down");
            }
            if (c == unknown) {
                throw new IllegalStateException("bug");
            }
            return c == ok;
        });

        assertEquals(4, report.scanned());
        assertEquals(1, report.affected());
        assertFalse(report.interrupted());
        assertEquals(List.of(
                new BatchItemError(known.getConversationId(), "DELIVERY_FAILED", "transport down"),
                new BatchItemError(unknown.getConversationId(), "INTERNAL_ERROR", "bug")
        ), report.errors());
    }

    @Test
    void interruptStopsBetweenItems() {
        FeConversation first = conversation();
        FeConversation second = conversation();

        BatchReport report = BatchRun.over("test", List.of(first, second), c -> {
            Thread.currentThread().interrupt();
            return true;
        });

        assertTrue(report.interrupted());
        assertEquals(1, report.scanned());
        assertEquals(1, report.affected());
    }

    private FeConversation conversation() {
        return FunnelFixtures.conversationAt(BLOCK_WELCOME, clock.nowOffset());
    }
}
