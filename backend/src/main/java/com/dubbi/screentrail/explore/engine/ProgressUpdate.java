package com.dubbi.screentrail.explore.engine;

import java.time.Duration;
import java.util.UUID;

public record ProgressUpdate(
        UUID sessionId,
        int screensExplored,
        int elementsDiscovered,
        int edgesRecorded,
        int currentDepth,
        Duration elapsed
) {}
