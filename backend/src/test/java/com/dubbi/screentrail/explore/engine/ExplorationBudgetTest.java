package com.dubbi.screentrail.explore.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExplorationBudgetTest {

    @Test
    void defaultsApplyToMissingKeys() {
        ExplorationBudget budget = ExplorationBudget.from(null);

        assertThat(budget.maxDepth()).isEqualTo(ExplorationBudget.DEFAULT_MAX_DEPTH);
        assertThat(budget.maxDuration()).isEqualTo(Duration.ofMinutes(ExplorationBudget.DEFAULT_MAX_MINUTES));
        assertThat(budget.resumeKnownStates()).isFalse();
    }

    @Test
    void parsesNumbersAndStrings() {
        Map<String, Object> json = new HashMap<>();
        json.put("maxDepth", "3");
        json.put("maxMinutes", 12);
        json.put("resumeKnownStates", "true");

        ExplorationBudget budget = ExplorationBudget.from(json);

        assertThat(budget.maxDepth()).isEqualTo(3);
        assertThat(budget.maxDuration()).isEqualTo(Duration.ofMinutes(12));
        assertThat(budget.resumeKnownStates()).isTrue();
    }

    @Test
    void garbageFallsBackAndNegativesAreClamped() {
        ExplorationBudget budget = ExplorationBudget.from(Map.of("maxDepth", "deep", "maxMinutes", -4));

        assertThat(budget.maxDepth()).isEqualTo(ExplorationBudget.DEFAULT_MAX_DEPTH);
        assertThat(budget.maxDuration()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void sessionStatesOnlyMoveForward() {
        assertThat(SessionState.IDLE.canTransitionTo(SessionState.RUNNING)).isTrue();
        assertThat(SessionState.RUNNING.canTransitionTo(SessionState.PAUSED_FOR_LOGIN)).isTrue();
        assertThat(SessionState.PAUSED_FOR_LOGIN.canTransitionTo(SessionState.RUNNING)).isTrue();
        assertThat(SessionState.COMPLETED.canTransitionTo(SessionState.RUNNING)).isFalse();
        assertThat(SessionState.ABORTED.isTerminal()).isTrue();
        assertThat(SessionState.PAUSED_FOR_PERMISSION.isPaused()).isTrue();
    }
}
