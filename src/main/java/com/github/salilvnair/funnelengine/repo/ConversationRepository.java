package com.github.salilvnair.funnelengine.repo;

import com.github.salilvnair.funnelengine.entity.ConversationStatus;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface ConversationRepository extends JpaRepository<FeConversation, UUID> {

    @Query("""
            select c
            from FeConversation c
            where c.status = :status
              and (:funnelId is null or c.funnelId = :funnelId)
              and (:scope is null or c.scope = :scope)
              and (:unclaimedOnly = false or c.oneTimeActionClaimed = false)
            order by c.createdAt asc
            """)
    List<FeConversation> findByStatusAndFilter(
            @Param("status") ConversationStatus status,
            @Param("funnelId") String funnelId,
            @Param("scope") String scope,
            @Param("unclaimedOnly") boolean unclaimedOnly
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update FeConversation c
            set c.oneTimeActionClaimed = true,
                c.updatedAt = :at,
                c.version = c.version + 1
            where c.conversationId = :id
              and c.oneTimeActionClaimed = false
            """)
    int claimOneTimeAction(@Param("id") UUID id, @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update FeConversation c
            set c.oneTimeActionClaimed = false,
                c.updatedAt = :at,
                c.version = c.version + 1
            where c.conversationId = :id
              and c.oneTimeActionClaimed = true
            """)
    int releaseOneTimeAction(@Param("id") UUID id, @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update FeConversation c
            set c.lastMessageAt = :at,
                c.version = c.version + 1
            where c.conversationId = :id
              and (c.lastMessageAt is null or c.lastMessageAt < :at)
            """)
    int touchLastMessageAt(@Param("id") UUID id, @Param("at") OffsetDateTime at);
}
