package com.dubbi.screentrail.graph.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
        name = "screen_states",
        uniqueConstraints = @UniqueConstraint(name = "uk_screen_states_app_fp", columnNames = {"app_id", "fingerprint"})
)
public class ScreenStateEntity {
    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "app_id", nullable = false)
    private String appId;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "app_version")
    private String appVersion;

    @Column(length = 1024)
    private String title;

    @Column(nullable = false)
    private int depth;

    /** 콤마로 이은 요소 정체성 id 목록 */
    @Column(name = "element_ids", columnDefinition = "text")
    private String elementIds;

    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ScreenStateEntity() {}

    public ScreenStateEntity(UUID id, String appId, String fingerprint) {
        this.id = id;
        this.appId = appId;
        this.fingerprint = fingerprint;
        this.discoveredAt = Instant.now();
        this.updatedAt = this.discoveredAt;
    }

    public UUID getId() {
        return id;
    }

    public String getAppId() {
        return appId;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public String getTitle() {
        return title;
    }

    public int getDepth() {
        return depth;
    }

    public List<String> getElementIds() {
        if (elementIds == null || elementIds.isBlank()) return List.of();
        return Arrays.asList(elementIds.split(","));
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void update(String appVersion, String title, int depth, List<String> elementIds) {
        this.appVersion = appVersion;
        if (title != null) this.title = title;
        // placeholder nodes carry depth -1 until explored
        if (depth >= 0) this.depth = depth;
        if (elementIds != null && !elementIds.isEmpty()) this.elementIds = String.join(",", elementIds);
        this.updatedAt = Instant.now();
    }
}
