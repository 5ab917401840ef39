package com.dubbi.screentrail.explore.engine;

/** 한 동작이 두 번 연속 실패해 현재 분기를 포기함 */
public class BranchAbandonedException extends ExplorationException {
    public BranchAbandonedException(String message, Throwable cause) {
        super(message, cause);
    }
}
