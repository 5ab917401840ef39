package com.dubbi.screentrail.testing;

import com.dubbi.screentrail.explore.classify.CompoundLoginGatePolicy;
import com.dubbi.screentrail.explore.classify.DangerousPatternRules;
import com.dubbi.screentrail.explore.classify.ElementClassifier;
import com.dubbi.screentrail.explore.classify.PermissionPromptDetector;
import com.dubbi.screentrail.explore.engine.EngineSettings;
import com.dubbi.screentrail.explore.engine.ExplorationBudget;
import com.dubbi.screentrail.explore.engine.ExplorationEngine;
import com.dubbi.screentrail.explore.engine.ExplorationReport;
import com.dubbi.screentrail.explore.engine.ExplorationSession;
import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprinter;
import com.dubbi.screentrail.explore.fingerprint.VolatilityFilter;
import com.dubbi.screentrail.explore.scroll.ScrollRevealer;
import com.dubbi.screentrail.graph.service.NavigationGraphBuilder;
import com.dubbi.screentrail.identity.service.AliasIndex;
import com.dubbi.screentrail.identity.service.AutoAliasGenerator;
import com.dubbi.screentrail.identity.service.IdentityRegistry;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 가짜 앱 위에 엔진 한 벌을 조립한다. 타임아웃은 짧게, 안정화 대기는 없이.
 */
public class EngineFixture implements AutoCloseable {
    public final FakeApp app;
    public final MutableClock clock = MutableClock.startingAt("2026-01-05T09:00:00Z");
    public final InMemoryPersistenceStore store;
    public final RecordingListener listener = new RecordingListener();
    public final ScreenFingerprinter fingerprinter = new ScreenFingerprinter(VolatilityFilter.defaults());
    public final IdentityRegistry identities = new IdentityRegistry(clock);
    public final AliasIndex aliases = new AliasIndex(AliasIndex.DEFAULT_THRESHOLD);
    public final NavigationGraphBuilder graph = new NavigationGraphBuilder(clock);
    public final ExplorationEngine engine;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "test-exploration");
        t.setDaemon(true);
        return t;
    });

    public EngineFixture(FakeApp app) {
        this(app, new InMemoryPersistenceStore());
    }

    public EngineFixture(FakeApp app, InMemoryPersistenceStore store) {
        this(app, store, testSettings());
    }

    public EngineFixture(FakeApp app, InMemoryPersistenceStore store, EngineSettings settings) {
        this.app = app;
        this.store = store;
        this.engine = new ExplorationEngine(
                app,
                fingerprinter,
                new ElementClassifier(DangerousPatternRules.defaults(), CompoundLoginGatePolicy.defaults()),
                new PermissionPromptDetector(PermissionPromptDetector.DEFAULT_PACKAGES),
                new ScrollRevealer(fingerprinter, 10),
                identities,
                aliases,
                new AutoAliasGenerator(),
                graph,
                store,
                listener,
                settings,
                executor,
                clock
        );
    }

    public static EngineSettings testSettings() {
        return new EngineSettings(
                Duration.ofMillis(200),
                Duration.ofMillis(200),
                Duration.ofMillis(200),
                Duration.ofSeconds(1),
                Duration.ZERO,
                3,
                3,
                3,
                0.85
        );
    }

    public static ExplorationBudget budget(int maxDepth) {
        return new ExplorationBudget(maxDepth, Duration.ofMinutes(5), false);
    }

    /** 현재 스레드에서 끝까지 실행 */
    public ExplorationReport run(ExplorationBudget budget) {
        return engine.run(engine.newSession(app.appId(), null, budget));
    }

    /** 엔진 스레드에서 실행하고 세션을 바로 돌려준다. */
    public ExplorationSession start(ExplorationBudget budget) {
        return engine.start(app.appId(), null, budget);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
