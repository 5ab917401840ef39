package com.dubbi.screentrail.explore.service;

import com.dubbi.screentrail.explore.engine.ExplorationListener;
import com.dubbi.screentrail.explore.engine.ExplorationReport;
import com.dubbi.screentrail.explore.engine.ExplorationSession;
import com.dubbi.screentrail.explore.engine.PauseRequested;
import com.dubbi.screentrail.explore.engine.ProgressUpdate;
import com.dubbi.screentrail.explore.engine.SessionState;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * 세션 이벤트를 SSE 구독자에게 전달한다.
 * 전송은 별도 스레드에서 하므로 느린 구독자가 엔진을 막지 않는다.
 */
@Component
public class ExplorationEventHub implements ExplorationListener {
    private static final Logger log = LoggerFactory.getLogger(ExplorationEventHub.class);

    private final ConcurrentHashMap<UUID, CopyOnWriteArrayList<SseEmitter>> emittersBySessionId = new ConcurrentHashMap<>();
    private final ExecutorService sender = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "exploration-sse");
        t.setDaemon(true);
        return t;
    });

    public SseEmitter subscribe(UUID sessionId) {
        SseEmitter emitter = new SseEmitter(0L);
        emittersBySessionId.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> remove(sessionId, emitter));
        emitter.onTimeout(() -> remove(sessionId, emitter));
        emitter.onError((e) -> remove(sessionId, emitter));

        // initial ping
        publish(sessionId, "PING", Map.of("ts", Instant.now().toString()));
        return emitter;
    }

    public void publish(UUID sessionId, String type, Object payload) {
        List<SseEmitter> emitters = emittersBySessionId.get(sessionId);
        if (emitters == null || emitters.isEmpty()) return;
        sender.execute(() -> send(sessionId, emitters, type, payload));
    }

    @Override
    public void onStateChanged(ExplorationSession session, SessionState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", state.name());
        payload.put("ts", Instant.now().toString());
        if (session.reason() != null) payload.put("reason", session.reason());
        publish(session.id(), "STATUS", payload);
    }

    @Override
    public void onPauseRequested(ExplorationSession session, PauseRequested pause) {
        publish(session.id(), "PAUSE", Map.of(
                "reason", pause.reason().name(),
                "screen", pause.screen().value()
        ));
    }

    @Override
    public void onProgress(ExplorationSession session, ProgressUpdate progress) {
        publish(session.id(), "PROGRESS", Map.of(
                "screensExplored", progress.screensExplored(),
                "elementsDiscovered", progress.elementsDiscovered(),
                "edgesRecorded", progress.edgesRecorded(),
                "depth", progress.currentDepth(),
                "elapsedMs", progress.elapsed().toMillis()
        ));
    }

    @Override
    public void onFinished(ExplorationSession session, ExplorationReport report) {
        publish(session.id(), "STATS", report.stats().toMap());
        sender.execute(() -> complete(session.id()));
    }

    @PreDestroy
    public void shutdown() {
        sender.shutdownNow();
    }

    private void send(UUID sessionId, List<SseEmitter> emitters, String type, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(type).data(payload, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("dropping SSE subscriber of {}: {}", sessionId, e.getMessage());
                remove(sessionId, emitter);
            }
        }
    }

    private void complete(UUID sessionId) {
        List<SseEmitter> emitters = emittersBySessionId.remove(sessionId);
        if (emitters == null) return;
        emitters.forEach(SseEmitter::complete);
    }

    private void remove(UUID sessionId, SseEmitter emitter) {
        List<SseEmitter> emitters = emittersBySessionId.get(sessionId);
        if (emitters == null) return;
        emitters.remove(emitter);
        if (emitters.isEmpty()) emittersBySessionId.remove(sessionId);
    }
}
