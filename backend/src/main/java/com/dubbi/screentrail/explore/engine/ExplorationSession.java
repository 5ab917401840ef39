package com.dubbi.screentrail.explore.engine;

import com.dubbi.screentrail.explore.fingerprint.VisitedStateIndex;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 탐색 세션 한 건의 상태.
 * 상태 전이와 실패 카운터는 엔진 스레드만 바꾸고, resume/abort는 어느 스레드에서든 부를 수 있다.
 */
public class ExplorationSession {
    private final UUID id;
    private final String appId;
    private final String entryPoint;
    private final ExplorationBudget budget;
    private final VisitedStateIndex visited = new VisitedStateIndex();
    private final ExplorationStats stats = new ExplorationStats();
    private final Set<String> discoveredIds = new HashSet<>();
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    private final CompletableFuture<ExplorationReport> completion = new CompletableFuture<>();

    private volatile SessionState state = SessionState.IDLE;
    private volatile CompletableFuture<Void> resumeSignal;
    private volatile String appVersion = "";
    private volatile String reason;
    private volatile Instant startedAt;
    private volatile Instant deadline;
    private volatile int currentDepth;
    private int consecutiveFailures;

    public ExplorationSession(UUID id, String appId, String entryPoint, ExplorationBudget budget) {
        this.id = id;
        this.appId = appId;
        this.entryPoint = entryPoint;
        this.budget = budget;
    }

    public UUID id() {
        return id;
    }

    public String appId() {
        return appId;
    }

    public String entryPoint() {
        return entryPoint;
    }

    public ExplorationBudget budget() {
        return budget;
    }

    public SessionState state() {
        return state;
    }

    public String appVersion() {
        return appVersion;
    }

    public String reason() {
        return reason;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public int currentDepth() {
        return currentDepth;
    }

    public VisitedStateIndex visited() {
        return visited;
    }

    public ExplorationStats stats() {
        return stats;
    }

    /** 세션이 끝나면 보고서로 완료된다. */
    public CompletableFuture<ExplorationReport> completion() {
        return completion;
    }

    /** 일시정지 상태일 때만 재개한다. */
    public boolean resume() {
        CompletableFuture<Void> signal = resumeSignal;
        if (signal == null || !state.isPaused()) return false;
        return signal.complete(null);
    }

    /** 어느 상태에서든 취소를 요청한다. 이미 끝난 세션이면 false. */
    public boolean abort() {
        if (state.isTerminal()) return false;
        boolean first = cancellation.complete(null);
        CompletableFuture<Void> signal = resumeSignal;
        if (signal != null) signal.complete(null);
        return first;
    }

    public boolean isCancelled() {
        return cancellation.isDone();
    }

    CompletableFuture<Void> cancellation() {
        return cancellation;
    }

    void checkNotCancelled() {
        if (cancellation.isDone()) throw new ExplorationAbortedException("exploration aborted by request");
    }

    void begin(Instant now) {
        transitionTo(SessionState.RUNNING);
        this.startedAt = now;
        this.deadline = now.plus(budget.maxDuration());
    }

    Instant deadline() {
        return deadline;
    }

    /** 일시정지로 보낸 시간만큼 시간 예산을 늘린다. */
    void extendDeadline(Duration paused) {
        if (deadline != null && paused != null && !paused.isNegative()) {
            this.deadline = deadline.plus(paused);
        }
    }

    int recordDiscovered(Collection<String> identityIds) {
        discoveredIds.addAll(identityIds);
        return discoveredIds.size();
    }

    void setAppVersion(String appVersion) {
        this.appVersion = appVersion == null ? "" : appVersion;
    }

    void setCurrentDepth(int depth) {
        this.currentDepth = depth;
    }

    /** 재개 신호를 먼저 만든 뒤 상태를 바꾼다. */
    void enterPause(PauseReason pauseReason) {
        resumeSignal = new CompletableFuture<>();
        transitionTo(pauseReason.state());
    }

    /** 재개 또는 취소까지 기다린다. */
    void awaitResume() {
        CompletableFuture<Void> signal = resumeSignal;
        try {
            if (signal != null) signal.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExplorationAbortedException("interrupted while paused");
        } catch (ExecutionException e) {
            throw new ExplorationAbortedException("resume signal failed: " + e.getCause());
        }
        checkNotCancelled();
        resumeSignal = null;
        transitionTo(SessionState.RUNNING);
    }

    int recordFailure() {
        stats.failure();
        return ++consecutiveFailures;
    }

    void recordSuccess() {
        consecutiveFailures = 0;
    }

    void finish(SessionState terminal, String reason) {
        this.reason = reason;
        transitionTo(terminal);
    }

    void complete(ExplorationReport report) {
        completion.complete(report);
    }

    synchronized void transitionTo(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("illegal session transition " + state + " -> " + next);
        }
        state = next;
    }
}
