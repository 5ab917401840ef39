package com.dubbi.screentrail.explore.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 세션 카운터. 엔진 스레드가 쓰고 조회 API가 읽는다.
 */
public class ExplorationStats {
    private final AtomicInteger screensExplored = new AtomicInteger();
    private final AtomicInteger elementsDiscovered = new AtomicInteger();
    private final AtomicInteger edgesRecorded = new AtomicInteger();
    private final AtomicInteger dangerousSkipped = new AtomicInteger();
    private final AtomicInteger loginScreens = new AtomicInteger();
    private final AtomicInteger scrollContainers = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger branchesAbandoned = new AtomicInteger();

    public record Snapshot(
            int screensExplored,
            int elementsDiscovered,
            int edgesRecorded,
            int dangerousSkipped,
            int loginScreens,
            int scrollContainers,
            int failures,
            int branchesAbandoned
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("screensExplored", screensExplored);
            m.put("elementsDiscovered", elementsDiscovered);
            m.put("edgesRecorded", edgesRecorded);
            m.put("dangerousSkipped", dangerousSkipped);
            m.put("loginScreens", loginScreens);
            m.put("scrollContainers", scrollContainers);
            m.put("failures", failures);
            m.put("branchesAbandoned", branchesAbandoned);
            return m;
        }
    }

    void screenExplored() {
        screensExplored.incrementAndGet();
    }

    void elementsDiscovered(int count) {
        elementsDiscovered.set(count);
    }

    void edgeRecorded() {
        edgesRecorded.incrementAndGet();
    }

    void dangerousSkipped(int count) {
        dangerousSkipped.addAndGet(count);
    }

    void loginScreen() {
        loginScreens.incrementAndGet();
    }

    void scrollContainer() {
        scrollContainers.incrementAndGet();
    }

    void failure() {
        failures.incrementAndGet();
    }

    void branchAbandoned() {
        branchesAbandoned.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                screensExplored.get(),
                elementsDiscovered.get(),
                edgesRecorded.get(),
                dangerousSkipped.get(),
                loginScreens.get(),
                scrollContainers.get(),
                failures.get(),
                branchesAbandoned.get()
        );
    }
}
