package com.dubbi.screentrail.explore.engine;

/**
 * 탐색 엔진 예외의 공통 상위 타입
 */
public class ExplorationException extends RuntimeException {
    public ExplorationException(String message) {
        super(message);
    }

    public ExplorationException(String message, Throwable cause) {
        super(message, cause);
    }
}
