package com.dubbi.screentrail.explore.engine;

/** 외부 취소 요청 */
public class ExplorationAbortedException extends ExplorationException {
    public ExplorationAbortedException(String message) {
        super(message);
    }
}
