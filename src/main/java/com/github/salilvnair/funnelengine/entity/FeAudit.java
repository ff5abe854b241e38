package com.github.salilvnair.funnelengine.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "fe_audit")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "audit_id")
    private Long auditId;

    @Column(nullable = false, name = "conversation_id")
    private UUID conversationId;

    /**
     * One of {@link com.github.salilvnair.funnelengine.audit.FunnelAuditStage}.
     */
    @Column(nullable = false)
    private String stage;

    @Column(nullable = false, name = "payload_json")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payloadJson;

    @Column(nullable = false, name = "created_at")
    private OffsetDateTime createdAt;
}
