package com.dubbi.screentrail.explore.engine;

import java.time.Duration;

/**
 * 엔진 타이밍/재시도 설정
 */
public record EngineSettings(
        Duration readTimeout,
        Duration dispatchTimeout,
        Duration launchTimeout,
        Duration settleWindow,
        Duration settlePollInterval,
        int maxSettleReads,
        int maxConsecutiveFailures,
        int maxExternalBackAttempts,
        double backSimilarityThreshold
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
                Duration.ofMillis(1500),
                Duration.ofMillis(1500),
                Duration.ofSeconds(15),
                Duration.ofMillis(1500),
                Duration.ofMillis(250),
                5,
                3,
                3,
                0.85
        );
    }
}
