package com.github.salilvnair.funnelengine.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "fe_funnel")
@Data
public class FeFunnel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "funnel_id", nullable = false)
    private String funnelId;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "scope")
    private String scope;

    /**
     * Published graph document: {@code {startBlockId, stages[], blocks{}}}.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "flow_json", nullable = false)
    private String flowJson;

    @Column(name = "published")
    private boolean published;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
