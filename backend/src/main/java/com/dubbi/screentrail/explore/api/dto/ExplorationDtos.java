package com.dubbi.screentrail.explore.api.dto;

import com.dubbi.screentrail.explore.engine.SessionState;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public final class ExplorationDtos {
    private ExplorationDtos() {}

    public record ExplorationRunDTO(
            UUID id,
            String appId,
            String entryPoint,
            SessionState status,
            int maxDepth,
            int maxMinutes,
            String appVersion,
            Map<String, Object> stats,
            Instant createdAt,
            Instant startedAt,
            Instant finishedAt,
            String errorMessage
    ) {}

    public record StartExplorationRequest(
            @NotBlank String appId,
            String entryUrl,
            Map<String, Object> budget
    ) {}

    public record SessionCommandResponse(UUID id, SessionState status, boolean accepted) {}
}
