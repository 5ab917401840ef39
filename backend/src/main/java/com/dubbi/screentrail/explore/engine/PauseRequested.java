package com.dubbi.screentrail.explore.engine;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import java.util.UUID;

public record PauseRequested(
        UUID sessionId,
        String appId,
        PauseReason reason,
        ScreenFingerprint screen
) {}
