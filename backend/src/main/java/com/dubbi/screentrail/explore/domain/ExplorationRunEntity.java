package com.dubbi.screentrail.explore.domain;

import com.dubbi.screentrail.explore.engine.ExplorationStats;
import com.dubbi.screentrail.explore.engine.SessionState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "exploration_runs")
public class ExplorationRunEntity {
    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "app_id", nullable = false)
    private String appId;

    @Column(name = "entry_point", length = 2048)
    private String entryPoint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SessionState status;

    @Column(name = "max_depth", nullable = false)
    private int maxDepth;

    @Column(name = "max_minutes", nullable = false)
    private int maxMinutes;

    @Column(name = "app_version")
    private String appVersion;

    @Column(name = "screens_explored", nullable = false)
    private int screensExplored;

    @Column(name = "elements_discovered", nullable = false)
    private int elementsDiscovered;

    @Column(name = "edges_recorded", nullable = false)
    private int edgesRecorded;

    @Column(name = "dangerous_skipped", nullable = false)
    private int dangerousSkipped;

    @Column(name = "login_screens", nullable = false)
    private int loginScreens;

    @Column(name = "failures", nullable = false)
    private int failures;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "error_message", length = 2048)
    private String errorMessage;

    protected ExplorationRunEntity() {}

    public ExplorationRunEntity(UUID id, String appId, String entryPoint, int maxDepth, int maxMinutes) {
        this.id = id;
        this.appId = appId;
        this.entryPoint = entryPoint;
        this.status = SessionState.IDLE;
        this.maxDepth = maxDepth;
        this.maxMinutes = maxMinutes;
        this.createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getAppId() {
        return appId;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public SessionState getStatus() {
        return status;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxMinutes() {
        return maxMinutes;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public int getScreensExplored() {
        return screensExplored;
    }

    public int getElementsDiscovered() {
        return elementsDiscovered;
    }

    public int getEdgesRecorded() {
        return edgesRecorded;
    }

    public int getDangerousSkipped() {
        return dangerousSkipped;
    }

    public int getLoginScreens() {
        return loginScreens;
    }

    public int getFailures() {
        return failures;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void markState(SessionState state) {
        if (state == SessionState.RUNNING && startedAt == null) {
            this.startedAt = Instant.now();
        }
        this.status = state;
    }

    public void markFinished(SessionState state, String appVersion, String reason, ExplorationStats.Snapshot stats) {
        this.status = state;
        this.appVersion = appVersion;
        this.errorMessage = reason;
        updateStats(stats);
        this.finishedAt = Instant.now();
    }

    public void updateStats(ExplorationStats.Snapshot stats) {
        this.screensExplored = stats.screensExplored();
        this.elementsDiscovered = stats.elementsDiscovered();
        this.edgesRecorded = stats.edgesRecorded();
        this.dangerousSkipped = stats.dangerousSkipped();
        this.loginScreens = stats.loginScreens();
        this.failures = stats.failures();
    }
}
