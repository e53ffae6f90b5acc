package com.example.reportsync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A configured connection from one project to one external tracker.
 *
 * The tracker specific part lives in {@code config} as JSON and is decoded
 * per {@link IntegrationType} by IntegrationConfigMapper.
 */
@Entity
@Table(name = "integrations", indexes = {
        @Index(name = "idx_integrations_project_id", columnList = "project_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Integration extends BaseEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private IntegrationType type;

    @Column(name = "config", nullable = false, length = 8000)
    private String config;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "usage_count", nullable = false)
    private int usageCount = 0;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    /**
     * Record one successful use of this integration.
     */
    public void markUsed(Instant now) {
        this.lastUsedAt = now;
        this.usageCount++;
    }
}
