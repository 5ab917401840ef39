package com.dubbi.screentrail.graph.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "navigation_edges",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_navigation_edges_transition",
                columnNames = {"app_id", "from_fingerprint", "trigger_element_id", "to_fingerprint"}
        )
)
public class NavigationEdgeEntity {
    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "app_id", nullable = false)
    private String appId;

    @Column(name = "from_fingerprint", nullable = false, length = 64)
    private String fromFingerprint;

    @Column(name = "trigger_element_id", nullable = false, length = 32)
    private String triggerElementId;

    @Column(name = "to_fingerprint", nullable = false, length = 64)
    private String toFingerprint;

    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt;

    protected NavigationEdgeEntity() {}

    public NavigationEdgeEntity(UUID id, String appId, String fromFingerprint, String triggerElementId, String toFingerprint, Instant discoveredAt) {
        this.id = id;
        this.appId = appId;
        this.fromFingerprint = fromFingerprint;
        this.triggerElementId = triggerElementId;
        this.toFingerprint = toFingerprint;
        this.discoveredAt = discoveredAt;
    }

    public UUID getId() {
        return id;
    }

    public String getAppId() {
        return appId;
    }

    public String getFromFingerprint() {
        return fromFingerprint;
    }

    public String getTriggerElementId() {
        return triggerElementId;
    }

    public String getToFingerprint() {
        return toFingerprint;
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }
}
