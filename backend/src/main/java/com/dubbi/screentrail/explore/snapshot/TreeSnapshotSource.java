package com.dubbi.screentrail.explore.snapshot;

import java.util.concurrent.CompletableFuture;

/**
 * 플랫폼 접근성/DOM 트리를 읽고 행동을 보내는 어댑터.
 * 모든 호출은 비동기이며 엔진이 타임아웃을 건다.
 */
public interface TreeSnapshotSource {
    CompletableFuture<ScreenSnapshot> readSnapshot(String appId);

    CompletableFuture<Boolean> dispatchAction(String appId, String handle, ActionKind kind);

    /** 진입점이 있으면 대상 앱을 띄운다. 기본 구현은 이미 떠 있다고 가정한다. */
    default CompletableFuture<Boolean> launch(String appId, String entryPoint) {
        return CompletableFuture.completedFuture(Boolean.TRUE);
    }
}
