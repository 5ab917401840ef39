package com.dubbi.screentrail.explore.engine;

/** 재시도할 수 있는 읽기/행동 실패 */
public class TransientReadFailure extends ExplorationException {
    public TransientReadFailure(String message) {
        super(message);
    }

    public TransientReadFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
