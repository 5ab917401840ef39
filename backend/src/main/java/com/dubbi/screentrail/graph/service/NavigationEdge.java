package com.dubbi.screentrail.graph.service;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import java.time.Instant;

public record NavigationEdge(
        ScreenFingerprint from,
        String triggerElementId,
        ScreenFingerprint to,
        Instant discoveredAt
) {
    /** 중복 판정 키 (발견 시각 제외) */
    public record Transition(ScreenFingerprint from, String triggerElementId, ScreenFingerprint to) {}

    public Transition transition() {
        return new Transition(from, triggerElementId, to);
    }
}
