package com.github.salilvnair.funnelengine.entity;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "fe_resource")
@Data
public class FeResource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "resource_id")
    private Long resourceId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "scope", nullable = false)
    private String scope;

    @Column(name = "link", nullable = false)
    private String link;

    @Column(name = "category")
    private String category;

    @Column(name = "enabled")
    private boolean enabled;
}
