package com.github.salilvnair.funnelengine.store;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.entity.FeMessage;
import com.github.salilvnair.funnelengine.entity.MessageRole;
import com.github.salilvnair.funnelengine.repo.ConversationRepository;
import com.github.salilvnair.funnelengine.repo.MessageRepository;
import com.github.salilvnair.funnelengine.spi.ActiveConversationFilter;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Relational store. {@link #casUpdate} is optimistic: the row's {@code version} column is part
 * of the UPDATE's WHERE clause, so a concurrent writer makes this one affect zero rows.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Optional<FeConversation> load(UUID conversationId) {
        return conversationRepository.findById(conversationId);
    }

    @Override
    public FeConversation create(FeConversation conversation) {
        try {
            return conversationRepository.saveAndFlush(conversation);
        }
        catch (DataAccessException e) {
            log.error("Failed to create conversation {}", conversation.getConversationId(), e);
            throw new FunnelEngineException(FunnelEngineErrorCode.CONVERSATION_PERSIST_FAILED,
                    "Failed to create conversation " + conversation.getConversationId(), e);
        }
    }

    @Override
    public int casUpdate(UUID conversationId, Predicate<FeConversation> predicate, Consumer<FeConversation> mutation) {
        try {
            Integer affected = transactionTemplate.execute(status -> {
                Optional<FeConversation> current = conversationRepository.findById(conversationId);
                if (current.isEmpty() || !predicate.test(current.get())) {
                    return 0;
                }
                FeConversation row = current.get();
                mutation.accept(row);
                conversationRepository.saveAndFlush(row);
                return 1;
            });
            return affected == null ? 0 : affected;
        }
        catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Conditional update lost to a concurrent writer for conversation {}", conversationId);
            return 0;
        }
    }

    @Override
    public List<FeConversation> listActive(ActiveConversationFilter filter) {
        ActiveConversationFilter f = filter == null ? ActiveConversationFilter.all() : filter;
        return conversationRepository.findByStatusAndFilter(
                ConversationStatus.ACTIVE, f.funnelId(), f.scope(), f.unclaimedOnly());
    }

    @Override
    public void appendMessage(UUID conversationId, MessageRole role, String content, OffsetDateTime at) {
        transactionTemplate.executeWithoutResult(status -> {
            messageRepository.save(FeMessage.builder()
                    .conversationId(conversationId)
                    .role(role)
                    .content(content)
                    .createdAt(at)
                    .build());
            conversationRepository.touchLastMessageAt(conversationId, at);
        });
    }

    @Override
    public boolean claimOneTimeAction(UUID conversationId, OffsetDateTime at) {
        Integer affected = transactionTemplate.execute(status -> conversationRepository.claimOneTimeAction(conversationId, at));
        return affected != null && affected == 1;
    }

    @Override
    public boolean releaseOneTimeAction(UUID conversationId, OffsetDateTime at) {
        Integer affected = transactionTemplate.execute(status -> conversationRepository.releaseOneTimeAction(conversationId, at));
        return affected != null && affected == 1;
    }
}
