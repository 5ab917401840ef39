package com.dubbi.screentrail.explore.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * 탐색 세션 상태 머신
 */
public enum SessionState {
    IDLE,
    RUNNING,
    PAUSED_FOR_LOGIN,
    PAUSED_FOR_PERMISSION,
    COMPLETED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }

    public boolean isPaused() {
        return this == PAUSED_FOR_LOGIN || this == PAUSED_FOR_PERMISSION;
    }

    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }

    private Set<SessionState> allowedNext() {
        return switch (this) {
            case IDLE -> EnumSet.of(RUNNING, ABORTED);
            case RUNNING -> EnumSet.of(PAUSED_FOR_LOGIN, PAUSED_FOR_PERMISSION, COMPLETED, ABORTED, FAILED);
            case PAUSED_FOR_LOGIN, PAUSED_FOR_PERMISSION -> EnumSet.of(RUNNING, ABORTED, FAILED);
            case COMPLETED, ABORTED, FAILED -> EnumSet.noneOf(SessionState.class);
        };
    }
}
