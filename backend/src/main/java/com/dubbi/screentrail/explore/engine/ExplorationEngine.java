package com.dubbi.screentrail.explore.engine;

import com.dubbi.screentrail.explore.classify.ClassifiedElement;
import com.dubbi.screentrail.explore.classify.ElementCategory;
import com.dubbi.screentrail.explore.classify.ElementClassifier;
import com.dubbi.screentrail.explore.classify.PermissionPromptDetector;
import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprinter;
import com.dubbi.screentrail.explore.fingerprint.VolatilityFilter;
import com.dubbi.screentrail.explore.scroll.ScrollDriver;
import com.dubbi.screentrail.explore.scroll.ScrollRevealer;
import com.dubbi.screentrail.explore.snapshot.ActionKind;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ElementTrees;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import com.dubbi.screentrail.explore.snapshot.TreeSnapshotSource;
import com.dubbi.screentrail.graph.service.NavigationGraphBuilder;
import com.dubbi.screentrail.identity.service.AliasIndex;
import com.dubbi.screentrail.identity.service.AliasSource;
import com.dubbi.screentrail.identity.service.AutoAliasGenerator;
import com.dubbi.screentrail.identity.service.ElementSignature;
import com.dubbi.screentrail.identity.service.IdentityRegistry;
import com.dubbi.screentrail.persistence.PersistenceStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 깊이 우선 UI 탐색 엔진.
 *
 * <p>화면마다 요소를 분류/등록하고 안전한 요소만 클릭한다. 클릭 결과 화면이 처음 보는 지문이면
 * 한 단계 깊이로 내려가고, 분기가 끝나면 원래 화면으로 돌아온다. 로그인/권한 화면에서는
 * 멈추고 외부의 resume을 기다린다.
 *
 * <p>세션 하나는 한 스레드에서만 진행된다. 플랫폼 호출은 모두 타임아웃과 취소를 건다.
 */
public class ExplorationEngine {
    private static final Logger log = LoggerFactory.getLogger(ExplorationEngine.class);

    private final TreeSnapshotSource source;
    private final ScreenFingerprinter fingerprinter;
    private final ElementClassifier classifier;
    private final PermissionPromptDetector permissionDetector;
    private final ScrollRevealer scrollRevealer;
    private final IdentityRegistry identityRegistry;
    private final AliasIndex aliasIndex;
    private final AutoAliasGenerator aliasGenerator;
    private final NavigationGraphBuilder graphBuilder;
    private final PersistenceStore persistenceStore;
    private final ExplorationListener listener;
    private final EngineSettings settings;
    private final Executor executor;
    private final Clock clock;

    public ExplorationEngine(
            TreeSnapshotSource source,
            ScreenFingerprinter fingerprinter,
            ElementClassifier classifier,
            PermissionPromptDetector permissionDetector,
            ScrollRevealer scrollRevealer,
            IdentityRegistry identityRegistry,
            AliasIndex aliasIndex,
            AutoAliasGenerator aliasGenerator,
            NavigationGraphBuilder graphBuilder,
            PersistenceStore persistenceStore,
            ExplorationListener listener,
            EngineSettings settings,
            Executor executor,
            Clock clock
    ) {
        this.source = source;
        this.fingerprinter = fingerprinter;
        this.classifier = classifier;
        this.permissionDetector = permissionDetector;
        this.scrollRevealer = scrollRevealer;
        this.identityRegistry = identityRegistry;
        this.aliasIndex = aliasIndex;
        this.aliasGenerator = aliasGenerator;
        this.graphBuilder = graphBuilder;
        this.persistenceStore = persistenceStore;
        this.listener = ExplorationListener.composite(List.of(listener));
        this.settings = settings;
        this.executor = executor;
        this.clock = clock;
    }

    public ExplorationSession newSession(String appId, String entryPoint, ExplorationBudget budget) {
        return new ExplorationSession(UUID.randomUUID(), appId, entryPoint, budget);
    }

    /** 세션을 엔진 executor에서 실행한다. */
    public void launch(ExplorationSession session) {
        executor.execute(() -> run(session));
    }

    public ExplorationSession start(String appId, String entryPoint, ExplorationBudget budget) {
        ExplorationSession session = newSession(appId, entryPoint, budget);
        launch(session);
        return session;
    }

    /**
     * 세션을 현재 스레드에서 끝까지 실행한다.
     * 어떤 종료 상태든 그래프/정체성/별칭을 flush한 뒤 보고서를 돌려준다.
     */
    public ExplorationReport run(ExplorationSession session) {
        session.begin(clock.instant());
        listener.onStateChanged(session, session.state());
        log.info("[Explore] session {} started for {} (maxDepth={}, maxDuration={})",
                session.id(), session.appId(), session.budget().maxDepth(), session.budget().maxDuration());

        SessionState terminal;
        String reason = null;
        try {
            prepare(session);
            ScreenSnapshot entry = readEntry(session);
            exploreFrom(session, entry, 0);
            terminal = SessionState.COMPLETED;
        } catch (BudgetExceededException e) {
            terminal = SessionState.ABORTED;
            reason = e.getMessage();
        } catch (ExplorationAbortedException e) {
            terminal = SessionState.ABORTED;
            reason = e.getMessage();
        } catch (UnrecoverableReadFailure e) {
            terminal = SessionState.FAILED;
            reason = e.getMessage();
        } catch (BranchAbandonedException e) {
            terminal = SessionState.FAILED;
            reason = "exploration stopped: " + e.getMessage();
        } catch (RuntimeException e) {
            log.error("[Explore] session {} crashed", session.id(), e);
            terminal = SessionState.FAILED;
            reason = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        flush(session);
        session.finish(terminal, reason);
        listener.onStateChanged(session, terminal);

        ExplorationReport report = new ExplorationReport(
                session.id(),
                session.appId(),
                session.appVersion(),
                terminal,
                reason,
                session.stats().snapshot(),
                elapsed(session)
        );
        log.info("[Explore] session {} finished {} ({}) stats={}",
                session.id(), terminal, reason == null ? "-" : reason, report.stats().toMap());
        listener.onFinished(session, report);
        session.complete(report);
        return report;
    }

    private void prepare(ExplorationSession session) {
        String appId = session.appId();
        String entryPoint = session.entryPoint();
        if (entryPoint != null && !entryPoint.isBlank()) {
            attempt(session, "launch " + entryPoint, () -> {
                Boolean ok = await(session, call(() -> source.launch(appId, entryPoint)), settings.launchTimeout(), "launch");
                if (!Boolean.TRUE.equals(ok)) throw new TransientReadFailure("launch rejected for " + entryPoint);
                return ok;
            });
        }
        try {
            identityRegistry.load(persistenceStore.loadIdentities(appId));
            aliasIndex.load(persistenceStore.loadAliases(appId));
        } catch (RuntimeException e) {
            log.warn("[Explore] could not load stored identities for {}: {}", appId, e.getMessage(), e);
        }
    }

    private ScreenSnapshot readEntry(ExplorationSession session) {
        ScreenSnapshot entry = attempt(session, "read entry screen", () -> read(session));
        session.setAppVersion(entry.appVersion());
        if (session.budget().resumeKnownStates()) {
            try {
                var known = persistenceStore.loadVisitedStates(session.appId(), session.appVersion());
                session.visited().seed(known);
                log.info("[Explore] resuming with {} known states for {} {}", known.size(), session.appId(), session.appVersion());
            } catch (RuntimeException e) {
                log.warn("[Explore] could not load known states for {}: {}", session.appId(), e.getMessage(), e);
            }
        }
        if (!entry.isForeground(session.appId()) && !permissionDetector.isPermissionPrompt(entry)) {
            throw new UnrecoverableReadFailure("target app " + session.appId() + " is not in the foreground (found " + entry.foregroundAppId() + ")");
        }
        return entry;
    }

    /** 진입 화면 또는 재개 직후 화면에서 시작한다. 깊이는 호출자가 정한다. */
    private void exploreFrom(ExplorationSession session, ScreenSnapshot snapshot, int depth) {
        ScreenSnapshot current = snapshot;
        while (permissionDetector.isPermissionPrompt(current)) {
            current = pauseUntilResumed(session, PauseReason.PERMISSION_PROMPT, fingerprinter.computeFingerprint(current));
        }
        if (!current.isForeground(session.appId())) {
            log.warn("[Explore] {} is not in the foreground after resume (found {})", session.appId(), current.foregroundAppId());
            return;
        }
        ScreenFingerprint fingerprint = fingerprinter.computeFingerprint(current);
        if (!session.visited().markVisited(fingerprint)) {
            log.debug("[Explore] {} already visited", fingerprint.shortValue());
            return;
        }
        exploreScreen(session, current, fingerprint, depth);
    }

    /** 호출 전에 fingerprint는 이미 방문 처리되어 있어야 한다. */
    private void exploreScreen(ExplorationSession session, ScreenSnapshot snapshot, ScreenFingerprint fingerprint, int depth) {
        checkTime(session);
        session.setCurrentDepth(depth);
        session.stats().screenExplored();

        List<ClassifiedElement> classified = new ArrayList<>(classifier.classifyScreen(snapshot));
        classified.addAll(revealScrollable(session, snapshot));
        List<String> elementIds = register(session, classified);
        graphBuilder.addScreen(session.appId(), fingerprint, snapshot.title(), depth, new ArrayList<>(new LinkedHashSet<>(elementIds)));

        int dangerous = (int) classified.stream().filter(c -> c.is(ElementCategory.Kind.DANGEROUS)).count();
        session.stats().dangerousSkipped(dangerous);
        log.info("[Explore] screen {} depth={} elements={} dangerous={} title={}",
                fingerprint.shortValue(), depth, classified.size(), dangerous, snapshot.title());
        emitProgress(session);

        if (classified.stream().anyMatch(c -> c.is(ElementCategory.Kind.LOGIN_GATE))) {
            session.stats().loginScreen();
            ScreenSnapshot afterLogin = pauseUntilResumed(session, PauseReason.LOGIN_GATE, fingerprint);
            exploreFrom(session, afterLogin, depth);
            return;
        }

        for (int i = 0; i < classified.size(); i++) {
            ClassifiedElement target = classified.get(i);
            if (!target.isClickTarget()) continue;
            checkTime(session);
            try {
                exploreBranch(session, fingerprint, target.element(), elementIds.get(i), depth);
            } catch (BranchAbandonedException e) {
                session.stats().branchAbandoned();
                log.warn("[Explore] branch via '{}' on {} abandoned: {}", describe(target.element()), fingerprint.shortValue(), e.getMessage());
            }
            restoreOrigin(session, snapshot, fingerprint);
        }
    }

    private void exploreBranch(ExplorationSession session, ScreenFingerprint origin, ElementSnapshot element, String triggerId, int depth) {
        String appId = session.appId();
        log.debug("[Explore] click '{}' on {}", describe(element), origin.shortValue());
        attempt(session, "click '" + describe(element) + "'", () -> dispatch(session, element.handle(), ActionKind.CLICK));

        ScreenSnapshot after = awaitSettled(session);
        while (permissionDetector.isPermissionPrompt(after)) {
            after = pauseUntilResumed(session, PauseReason.PERMISSION_PROMPT, fingerprinter.computeFingerprint(after));
        }
        if (!after.isForeground(appId)) {
            leaveExternalApp(session, origin, triggerId, after);
            return;
        }

        ScreenFingerprint target = fingerprinter.computeFingerprint(after);
        boolean fresh = !session.visited().contains(target);
        if (fresh && depth + 1 > session.budget().maxDepth()) {
            throw new BudgetExceededException(BudgetExceededException.Limit.DEPTH,
                    "depth budget of " + session.budget().maxDepth() + " exceeded");
        }
        session.visited().markVisited(target);
        if (graphBuilder.addEdge(appId, origin, triggerId, target)) {
            session.stats().edgeRecorded();
        }
        if (fresh) {
            exploreScreen(session, after, target, depth + 1);
        }
    }

    private void leaveExternalApp(ExplorationSession session, ScreenFingerprint origin, String triggerId, ScreenSnapshot foreign) {
        String appId = session.appId();
        log.info("[Explore] left {} for {} from {}", appId, foreign.foregroundAppId(), origin.shortValue());
        session.visited().markVisited(ScreenFingerprint.EXTERNAL);
        if (graphBuilder.addEdge(appId, origin, triggerId, ScreenFingerprint.EXTERNAL)) {
            session.stats().edgeRecorded();
        }
        for (int i = 1; i <= settings.maxExternalBackAttempts(); i++) {
            pressBack(session);
            ScreenSnapshot now = awaitSettled(session);
            if (now.isForeground(appId)) return;
        }
        throw new UnrecoverableReadFailure("could not return to " + appId + " after "
                + settings.maxExternalBackAttempts() + " back actions");
    }

    /**
     * 지문이 원래 화면과 같을 때만 뒤로가기를 생략한다.
     * 뒤로가기 후 도착한 화면은 지문 또는 구조 유사도로 확인한다. 최대 두 번.
     */
    private void restoreOrigin(ExplorationSession session, ScreenSnapshot origin, ScreenFingerprint originFingerprint) {
        try {
            ScreenSnapshot current = attempt(session, "read for restore", () -> read(session));
            if (current.isForeground(session.appId()) && fingerprinter.computeFingerprint(current).equals(originFingerprint)) return;
            for (int i = 0; i < 2; i++) {
                pressBack(session);
                current = awaitSettled(session);
                if (isAt(current, origin, originFingerprint, session.appId())) return;
                if (!current.isForeground(session.appId())) {
                    throw new UnrecoverableReadFailure("left " + session.appId() + " while navigating back to "
                            + originFingerprint.shortValue());
                }
                log.warn("[Explore] back did not return to {} (attempt {})", originFingerprint.shortValue(), i + 1);
            }
            log.warn("[Explore] could not return to {}; continuing from current screen", originFingerprint.shortValue());
        } catch (BranchAbandonedException e) {
            log.warn("[Explore] restore to {} abandoned: {}", originFingerprint.shortValue(), e.getMessage());
        }
    }

    private boolean isAt(ScreenSnapshot current, ScreenSnapshot origin, ScreenFingerprint originFingerprint, String appId) {
        if (!current.isForeground(appId)) return false;
        if (fingerprinter.computeFingerprint(current).equals(originFingerprint)) return true;
        return fingerprinter.structuralSimilarity(current, origin) >= settings.backSimilarityThreshold();
    }

    private List<ClassifiedElement> revealScrollable(ExplorationSession session, ScreenSnapshot snapshot) {
        List<ClassifiedElement> out = new ArrayList<>();
        ScrollDriver driver = null;
        for (ElementSnapshot container : snapshot.elements()) {
            if (!container.scrollable()) continue;
            if (driver == null) driver = scrollDriver(session);
            session.stats().scrollContainer();
            for (ElementSnapshot revealed : scrollRevealer.revealAll(container, driver)) {
                out.add(new ClassifiedElement(revealed, classifier.classify(revealed, container)));
            }
        }
        return out;
    }

    private ScrollDriver scrollDriver(ExplorationSession session) {
        return new ScrollDriver() {
            @Override
            public boolean scroll(ElementSnapshot container, ActionKind direction) {
                try {
                    Boolean ok = await(session, call(() -> source.dispatchAction(session.appId(), container.handle(), direction)),
                            settings.dispatchTimeout(), direction.name());
                    session.recordSuccess();
                    // false means the end of the list, not a failure
                    return Boolean.TRUE.equals(ok);
                } catch (TransientReadFailure e) {
                    countFailure(session, direction.name(), e);
                    return false;
                }
            }

            @Override
            public Optional<ScreenSnapshot> read() {
                try {
                    return Optional.of(attempt(session, "read while scrolling", () -> ExplorationEngine.this.read(session)));
                } catch (BranchAbandonedException e) {
                    log.warn("[Explore] scroll read abandoned: {}", e.getMessage());
                    return Optional.empty();
                }
            }
        };
    }

    private List<String> register(ExplorationSession session, List<ClassifiedElement> classified) {
        String appId = session.appId();
        VolatilityFilter filter = fingerprinter.volatilityFilter();
        Map<String, String> idByPath = new HashMap<>();
        List<String> ids = new ArrayList<>(classified.size());
        for (ClassifiedElement c : classified) {
            ElementSnapshot element = c.element();
            String id = identityRegistry.resolveOrCreate(ElementSignature.of(element, filter), appId);
            ids.add(id);
            idByPath.putIfAbsent(ElementTrees.pathOf(element), id);
            String parentId = idByPath.get(element.ancestorPath());
            if (parentId != null) identityRegistry.recordParent(id, parentId);
            if (!aliasIndex.hasAliases(id, appId)) {
                aliasGenerator.generate(element, appId)
                        .ifPresent(phrase -> aliasIndex.addAlias(phrase, id, appId, AliasSource.AUTO));
            }
        }
        session.stats().elementsDiscovered(session.recordDiscovered(ids));
        return ids;
    }

    private ScreenSnapshot pauseUntilResumed(ExplorationSession session, PauseReason reason, ScreenFingerprint screen) {
        Instant pausedAt = clock.instant();
        session.enterPause(reason);
        listener.onStateChanged(session, session.state());
        log.info("[Explore] session {} paused ({}) at {}", session.id(), reason, screen.shortValue());
        listener.onPauseRequested(session, new PauseRequested(session.id(), session.appId(), reason, screen));

        session.awaitResume();
        session.extendDeadline(Duration.between(pausedAt, clock.instant()));
        listener.onStateChanged(session, session.state());
        log.info("[Explore] session {} resumed", session.id());
        return attempt(session, "read after resume", () -> read(session));
    }

    /** 두 번 연속 같은 지문이 나오거나 창/횟수가 다 될 때까지 읽는다. */
    private ScreenSnapshot awaitSettled(ExplorationSession session) {
        ScreenSnapshot previous = attempt(session, "read", () -> read(session));
        ScreenFingerprint previousFingerprint = fingerprinter.computeFingerprint(previous);
        Instant until = clock.instant().plus(settings.settleWindow());
        for (int reads = 1; reads < settings.maxSettleReads() && clock.instant().isBefore(until); reads++) {
            sleep(session, settings.settlePollInterval());
            ScreenSnapshot next = attempt(session, "read", () -> read(session));
            ScreenFingerprint nextFingerprint = fingerprinter.computeFingerprint(next);
            if (nextFingerprint.equals(previousFingerprint)) return next;
            previous = next;
            previousFingerprint = nextFingerprint;
        }
        return previous;
    }

    private void pressBack(ExplorationSession session) {
        attempt(session, "back", () -> dispatch(session, null, ActionKind.BACK));
    }

    /**
     * 한 동작을 최대 두 번 시도한다.
     * 두 번 실패하면 분기를 포기하고, 세션 전체의 연속 실패가 한도에 닿으면 Failed로 끝낸다.
     */
    private <T> T attempt(ExplorationSession session, String what, Supplier<T> op) {
        for (int attempt = 1; ; attempt++) {
            try {
                T result = op.get();
                session.recordSuccess();
                return result;
            } catch (TransientReadFailure e) {
                countFailure(session, what, e);
                if (attempt >= 2) {
                    throw new BranchAbandonedException(what + " failed twice", e);
                }
            }
        }
    }

    private void countFailure(ExplorationSession session, String what, TransientReadFailure e) {
        int consecutive = session.recordFailure();
        log.warn("[Explore] {} failed ({} consecutive): {}", what, consecutive, e.getMessage());
        if (consecutive >= settings.maxConsecutiveFailures()) {
            throw new UnrecoverableReadFailure(consecutive + " consecutive failures, last: " + what + ": " + e.getMessage(), e);
        }
    }

    private ScreenSnapshot read(ExplorationSession session) {
        ScreenSnapshot snapshot = await(session, call(() -> source.readSnapshot(session.appId())), settings.readTimeout(), "read snapshot");
        if (snapshot == null || snapshot.isEmpty()) {
            throw new TransientReadFailure("snapshot source returned no tree");
        }
        return snapshot;
    }

    private Boolean dispatch(ExplorationSession session, String handle, ActionKind kind) {
        Boolean ok = await(session, call(() -> source.dispatchAction(session.appId(), handle, kind)), settings.dispatchTimeout(), kind.name());
        if (!Boolean.TRUE.equals(ok)) {
            throw new TransientReadFailure(kind + " rejected" + (handle == null ? "" : " on " + handle));
        }
        return ok;
    }

    /** 어댑터가 future 대신 바로 예외를 던져도 일시적 실패로 본다. */
    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> platformCall) {
        try {
            CompletableFuture<T> future = platformCall.get();
            return future != null ? future : CompletableFuture.failedFuture(new IllegalStateException("adapter returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T await(ExplorationSession session, CompletableFuture<T> future, Duration timeout, String what) {
        session.checkNotCancelled();
        try {
            CompletableFuture.anyOf(future, session.cancellation()).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DispatchTimeoutException(what + " timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExplorationAbortedException("interrupted while waiting for " + what);
        } catch (ExecutionException e) {
            session.checkNotCancelled();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TransientReadFailure(what + " failed: " + cause.getMessage(), cause);
        }
        session.checkNotCancelled();
        return future.join();
    }

    private void sleep(ExplorationSession session, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) return;
        try {
            session.cancellation().get(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // interval elapsed without cancellation
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExplorationAbortedException("interrupted while settling");
        } catch (ExecutionException e) {
            throw new ExplorationAbortedException("cancellation failed: " + e.getCause());
        }
        session.checkNotCancelled();
    }

    private void checkTime(ExplorationSession session) {
        if (clock.instant().isAfter(session.deadline())) {
            throw new BudgetExceededException(BudgetExceededException.Limit.TIME,
                    "time budget of " + session.budget().maxDuration() + " exceeded");
        }
    }

    private void emitProgress(ExplorationSession session) {
        ExplorationStats.Snapshot stats = session.stats().snapshot();
        listener.onProgress(session, new ProgressUpdate(
                session.id(),
                stats.screensExplored(),
                stats.elementsDiscovered(),
                stats.edgesRecorded(),
                session.currentDepth(),
                elapsed(session)
        ));
    }

    private void flush(ExplorationSession session) {
        String appId = session.appId();
        flushStep(appId, "graph", () -> persistenceStore.flushGraph(session.appVersion(), graphBuilder.getGraph(appId)));
        flushStep(appId, "identities", () -> persistenceStore.flushIdentities(appId, identityRegistry.identities(appId)));
        flushStep(appId, "aliases", () -> persistenceStore.flushAliases(appId, aliasIndex.aliases(appId)));
    }

    private void flushStep(String appId, String what, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("[Explore] flushing {} for {} failed", what, appId, e);
        }
    }

    private Duration elapsed(ExplorationSession session) {
        if (session.startedAt() == null) return Duration.ZERO;
        return Duration.between(session.startedAt(), clock.instant());
    }

    private static String describe(ElementSnapshot element) {
        String text = element.displayText();
        return text.isEmpty() ? String.valueOf(element.handle()) : text;
    }
}
