package com.github.salilvnair.funnelengine.store;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.FeMessage;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.spi.ConversationStore;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Map-backed store for hosts without a database and for tests. Each record is replaced
 * through {@link ConcurrentMap#computeIfPresent}, which serializes writers per key, so
 * predicate and mutation run as one atomic step. Callers only ever see copies.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final ConcurrentMap<UUID, FeConversation> conversations = new ConcurrentHashMap<>();
    private final ConcurrentMap<UUID, List<FeMessage>> messages = new ConcurrentHashMap<>();
    private final AtomicLong messageSequence = new AtomicLong();

    @Override
    public Optional<FeConversation> load(UUID conversationId) {
        return Optional.ofNullable(conversations.get(conversationId)).map(FeConversation::copy);
    }

    @Override
    public FeConversation create(FeConversation conversation) {
        FeConversation stored = conversation.copy();
        stored.setVersion(0L);
        if (conversations.putIfAbsent(stored.getConversationId(), stored) != null) {
            throw new FunnelEngineException(FunnelEngineErrorCode.CONVERSATION_PERSIST_FAILED,
                    "Conversation " + stored.getConversationId() + " already exists");
        }
        return stored.copy();
    }

    @Override
    public int casUpdate(UUID conversationId, Predicate<FeConversation> predicate, Consumer<FeConversation> mutation) {
        AtomicInteger affected = new AtomicInteger();
        conversations.computeIfPresent(conversationId, (id, current) -> {
            if (!predicate.test(current.copy())) {
                return current;
            }
            FeConversation next = current.copy();
            mutation.accept(next);
            next.setVersion(current.getVersion() == null ? 1L : current.getVersion() + 1);
            affected.set(1);
            return next;
        });
        return affected.get();
    }

    @Override
    public List<FeConversation> listActive(ActiveConversationFilter filter) {
        ActiveConversationFilter f = filter == null ? ActiveConversationFilter.all() : filter;
        return conversations.values().stream()
                .filter(FeConversation::isActive)
                .filter(c -> f.funnelId() == null || Objects.equals(f.funnelId(), c.getFunnelId()))
                .filter(c -> f.scope() == null || Objects.equals(f.scope(), c.getScope()))
                .filter(c -> !f.unclaimedOnly() || !c.isOneTimeActionClaimed())
                .sorted(Comparator.comparing(FeConversation::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(FeConversation::copy)
                .toList();
    }

    @Override
    public void appendMessage(UUID conversationId, MessageRole role, String content, OffsetDateTime at) {
        messages.computeIfAbsent(conversationId, id -> new CopyOnWriteArrayList<>())
                .add(FeMessage.builder()
                        .messageId(messageSequence.incrementAndGet())
                        .conversationId(conversationId)
                        .role(role)
                        .content(content)
                        .createdAt(at)
                        .build());
        conversations.computeIfPresent(conversationId, (id, current) -> {
            if (current.getLastMessageAt() != null && !current.getLastMessageAt().isBefore(at)) {
                return current;
            }
            FeConversation next = current.copy();
            next.setLastMessageAt(at);
            return next;
        });
    }

    public List<FeMessage> messages(UUID conversationId) {
        return List.copyOf(messages.getOrDefault(conversationId, List.of()));
    }
}
