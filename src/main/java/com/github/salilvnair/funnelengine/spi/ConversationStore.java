package com.github.salilvnair.funnelengine.spi;

import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.MessageRole;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Persistence collaborator. The engine relies on exactly one concurrency primitive from it:
 * {@link #casUpdate} must test the predicate and apply the mutation as one atomic step
 * against the persisted record, across processes.
 */
public interface ConversationStore {

    Optional<FeConversation> load(UUID conversationId);

    FeConversation create(FeConversation conversation);

    /**
     * Applies {@code mutation} only if {@code predicate} holds for the current persisted state.
     *
     * @return number of records affected, {@code 0} when the predicate failed, the record is
     *         missing or a concurrent writer won
     */
    int casUpdate(UUID conversationId, Predicate<FeConversation> predicate, Consumer<FeConversation> mutation);

    List<FeConversation> listActive(ActiveConversationFilter filter);

    /**
     * Appends to the conversation's message log and moves its last-activity timestamp forward.
     */
    void appendMessage(UUID conversationId, MessageRole role, String content, OffsetDateTime at);

    default boolean claimOneTimeAction(UUID conversationId, OffsetDateTime at) {
        return casUpdate(conversationId,
                c -> !c.isOneTimeActionClaimed(),
                c -> {
                    c.setOneTimeActionClaimed(true);
                    c.setUpdatedAt(at);
                }) == 1;
    }

    default boolean releaseOneTimeAction(UUID conversationId, OffsetDateTime at) {
        return casUpdate(conversationId,
                FeConversation::isOneTimeActionClaimed,
                c -> {
                    c.setOneTimeActionClaimed(false);
                    c.setUpdatedAt(at);
                }) == 1;
    }
}
