package com.github.salilvnair.funnelengine.entity;

import com.github.salilvnair.funnelengine.engine.model.FunnelInteraction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "fe_conversation")
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class FeConversation {

    @Id
    @Column(name = "conversation_id")
    private UUID conversationId;

    @Column(name = "funnel_id", nullable = false)
    private String funnelId;

    /**
     * Owning scope of the funnel (tenant / experience); resources are looked up within it.
     */
    @Column(name = "scope")
    private String scope;

    @Column(name = "target_user_ref")
    private String targetUserRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private ConversationStatus status = ConversationStatus.ACTIVE;

    @Column(name = "current_block_id")
    private String currentBlockId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "user_path")
    @Builder.Default
    private List<String> userPath = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "interactions")
    @Builder.Default
    private List<FunnelInteraction> interactions = new ArrayList<>();

    /**
     * resourceName -> link handed out to this conversation. Once present, never regenerated.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "resolved_links")
    @Builder.Default
    private Map<String, String> resolvedLinks = new LinkedHashMap<>();

    @Column(name = "one_time_action_claimed", nullable = false)
    private boolean oneTimeActionClaimed;

    @Column(name = "last_reprompt_key")
    private String lastRePromptKey;

    @Column(name = "phase_start_time")
    private OffsetDateTime phaseStartTime;

    @Column(name = "last_message_at")
    private OffsetDateTime lastMessageAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isActive() {
        return status == ConversationStatus.ACTIVE;
    }

    public String resolvedLinkFor(String resourceName) {
        return resolvedLinks == null || resourceName == null ? null : resolvedLinks.get(resourceName);
    }

    /**
     * Timestamp of the most recent inbound or outbound message, or creation time when
     * nothing has been exchanged yet.
     */
    public OffsetDateTime lastActivityAt() {
        return lastMessageAt != null ? lastMessageAt : createdAt;
    }

    /**
     * Detached working copy; collections are copied so the original is never mutated.
     */
    public FeConversation copy() {
        return toBuilder()
                .userPath(userPath == null ? new ArrayList<>() : new ArrayList<>(userPath))
                .interactions(interactions == null ? new ArrayList<>() : new ArrayList<>(interactions))
                .resolvedLinks(resolvedLinks == null ? new LinkedHashMap<>() : new LinkedHashMap<>(resolvedLinks))
                .build();
    }

    @PrePersist
    @PreUpdate
    private void ensureCollections() {
        if (userPath == null) {
            userPath = new ArrayList<>();
        }
        if (interactions == null) {
            interactions = new ArrayList<>();
        }
        if (resolvedLinks == null) {
            resolvedLinks = new LinkedHashMap<>();
        }
    }
}
