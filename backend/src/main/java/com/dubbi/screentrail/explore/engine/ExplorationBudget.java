package com.dubbi.screentrail.explore.engine;

import java.time.Duration;
import java.util.Map;

public record ExplorationBudget(
        int maxDepth,
        Duration maxDuration,
        boolean resumeKnownStates
) {
    public static final int DEFAULT_MAX_DEPTH = 6;
    public static final int DEFAULT_MAX_MINUTES = 5;

    public static ExplorationBudget defaults() {
        return from(Map.of());
    }

    public static ExplorationBudget from(Map<String, Object> budget) {
        int maxDepth = intOrDefault(budget, "maxDepth", DEFAULT_MAX_DEPTH);
        int maxMinutes = intOrDefault(budget, "maxMinutes", DEFAULT_MAX_MINUTES);
        boolean resume = boolOrDefault(budget, "resumeKnownStates", false);
        return new ExplorationBudget(Math.max(0, maxDepth), Duration.ofMinutes(Math.max(1, maxMinutes)), resume);
    }

    public Map<String, Object> toMap() {
        return Map.of(
                "maxDepth", maxDepth,
                "maxMinutes", maxDuration.toMinutes(),
                "resumeKnownStates", resumeKnownStates
        );
    }

    private static int intOrDefault(Map<String, Object> map, String key, int defaultValue) {
        if (map == null) return defaultValue;
        Object v = map.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolOrDefault(Map<String, Object> map, String key, boolean defaultValue) {
        if (map == null) return defaultValue;
        Object v = map.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString().trim());
    }
}
