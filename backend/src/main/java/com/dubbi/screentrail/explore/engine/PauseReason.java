package com.dubbi.screentrail.explore.engine;

public enum PauseReason {
    LOGIN_GATE(SessionState.PAUSED_FOR_LOGIN),
    PERMISSION_PROMPT(SessionState.PAUSED_FOR_PERMISSION);

    private final SessionState state;

    PauseReason(SessionState state) {
        this.state = state;
    }

    public SessionState state() {
        return state;
    }
}
