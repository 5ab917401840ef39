package com.dubbi.screentrail.explore.snapshot;

/**
 * 탐색 중 대상 앱에 보내는 행동 타입
 */
public enum ActionKind {
    CLICK,
    BACK,
    SCROLL_FORWARD,
    SCROLL_BACKWARD
}
