package com.dubbi.screentrail.explore.engine;

/** 연속 실패 한도를 넘었거나 대상 앱으로 돌아올 수 없음. 세션은 Failed가 된다. */
public class UnrecoverableReadFailure extends ExplorationException {
    public UnrecoverableReadFailure(String message) {
        super(message);
    }

    public UnrecoverableReadFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
