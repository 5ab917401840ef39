package com.dubbi.screentrail.explore.engine;

import java.time.Duration;
import java.util.UUID;

/**
 * 세션 종료 시 요약
 */
public record ExplorationReport(
        UUID sessionId,
        String appId,
        String appVersion,
        SessionState finalState,
        String reason,
        ExplorationStats.Snapshot stats,
        Duration elapsed
) {}
