package com.dubbi.screentrail.explore.engine;

/** 읽기/행동이 정해진 시간 안에 끝나지 않음. 일시적 실패로 취급한다. */
public class DispatchTimeoutException extends TransientReadFailure {
    public DispatchTimeoutException(String message) {
        super(message);
    }
}
