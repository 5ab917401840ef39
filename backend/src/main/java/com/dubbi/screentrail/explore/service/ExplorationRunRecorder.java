package com.dubbi.screentrail.explore.service;

import com.dubbi.screentrail.explore.domain.ExplorationRunEntity;
import com.dubbi.screentrail.explore.domain.ExplorationRunRepository;
import com.dubbi.screentrail.explore.engine.ExplorationListener;
import com.dubbi.screentrail.explore.engine.ExplorationReport;
import com.dubbi.screentrail.explore.engine.ExplorationSession;
import com.dubbi.screentrail.explore.engine.ExplorationStats;
import com.dubbi.screentrail.explore.engine.ProgressUpdate;
import com.dubbi.screentrail.explore.engine.SessionState;
import jakarta.annotation.PreDestroy;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 세션 상태 변화를 exploration_runs 행에 반영한다.
 * 쓰기는 전용 스레드 하나에서 순서대로 처리하고 탐색 스레드는 기다리지 않는다.
 */
@Component
public class ExplorationRunRecorder implements ExplorationListener {
    private static final Logger log = LoggerFactory.getLogger(ExplorationRunRecorder.class);

    private final ExplorationRunRepository runRepository;
    private final ExecutorService writer;

    @Autowired
    public ExplorationRunRecorder(ExplorationRunRepository runRepository) {
        this(runRepository, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "exploration-runs");
            t.setDaemon(true);
            return t;
        }));
    }

    ExplorationRunRecorder(ExplorationRunRepository runRepository, ExecutorService writer) {
        this.runRepository = runRepository;
        this.writer = writer;
    }

    @Override
    public void onStateChanged(ExplorationSession session, SessionState state) {
        // terminal states are written by onFinished together with the stats
        if (state.isTerminal()) return;
        update(session.id(), "state " + state, run -> run.markState(state));
    }

    @Override
    public void onProgress(ExplorationSession session, ProgressUpdate progress) {
        ExplorationStats.Snapshot stats = session.stats().snapshot();
        update(session.id(), "progress", run -> run.updateStats(stats));
    }

    @Override
    public void onFinished(ExplorationSession session, ExplorationReport report) {
        update(session.id(), "result " + report.finalState(),
                run -> run.markFinished(report.finalState(), report.appVersion(), report.reason(), report.stats()));
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
    }

    private void update(UUID runId, String what, Consumer<ExplorationRunEntity> change) {
        writer.execute(() -> {
            try {
                runRepository.findById(runId).ifPresent(run -> {
                    change.accept(run);
                    runRepository.save(run);
                });
            } catch (RuntimeException e) {
                log.warn("[Explore] could not record {} for run {}: {}", what, runId, e.getMessage(), e);
            }
        });
    }
}
