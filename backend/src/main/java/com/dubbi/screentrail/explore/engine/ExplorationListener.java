package com.dubbi.screentrail.explore.engine;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 엔진 이벤트 수신자. 엔진 스레드에서 호출되므로 오래 붙잡지 않는다.
 */
public interface ExplorationListener {
    default void onStateChanged(ExplorationSession session, SessionState state) {}

    default void onPauseRequested(ExplorationSession session, PauseRequested pause) {}

    default void onProgress(ExplorationSession session, ProgressUpdate progress) {}

    default void onFinished(ExplorationSession session, ExplorationReport report) {}

    static ExplorationListener noop() {
        return new ExplorationListener() {};
    }

    /** 수신자 하나가 예외를 던져도 나머지는 계속 받는다. */
    static ExplorationListener composite(List<? extends ExplorationListener> listeners) {
        Logger log = LoggerFactory.getLogger(ExplorationListener.class);
        List<ExplorationListener> targets = List.copyOf(listeners);
        return new ExplorationListener() {
            @Override
            public void onStateChanged(ExplorationSession session, SessionState state) {
                targets.forEach(l -> guarded(log, l, () -> l.onStateChanged(session, state)));
            }

            @Override
            public void onPauseRequested(ExplorationSession session, PauseRequested pause) {
                targets.forEach(l -> guarded(log, l, () -> l.onPauseRequested(session, pause)));
            }

            @Override
            public void onProgress(ExplorationSession session, ProgressUpdate progress) {
                targets.forEach(l -> guarded(log, l, () -> l.onProgress(session, progress)));
            }

            @Override
            public void onFinished(ExplorationSession session, ExplorationReport report) {
                targets.forEach(l -> guarded(log, l, () -> l.onFinished(session, report)));
            }
        };
    }

    private static void guarded(Logger log, ExplorationListener target, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("listener {} failed: {}", target.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
