package com.dubbi.screentrail.config;

import com.dubbi.screentrail.explore.classify.CompoundLoginGatePolicy;
import com.dubbi.screentrail.explore.classify.DangerousPatternRules;
import com.dubbi.screentrail.explore.classify.ElementClassifier;
import com.dubbi.screentrail.explore.classify.PermissionPromptDetector;
import com.dubbi.screentrail.explore.engine.ExplorationEngine;
import com.dubbi.screentrail.explore.engine.ExplorationListener;
import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprinter;
import com.dubbi.screentrail.explore.fingerprint.VolatilityFilter;
import com.dubbi.screentrail.explore.scroll.ScrollRevealer;
import com.dubbi.screentrail.explore.snapshot.TreeSnapshotSource;
import com.dubbi.screentrail.graph.service.NavigationGraphBuilder;
import com.dubbi.screentrail.identity.service.AliasIndex;
import com.dubbi.screentrail.identity.service.AutoAliasGenerator;
import com.dubbi.screentrail.identity.service.IdentityRegistry;
import com.dubbi.screentrail.persistence.PersistenceStore;
import com.dubbi.screentrail.platform.web.PlaywrightTreeSnapshotSource;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ExplorationProperties.class)
public class ExplorationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VolatilityFilter volatilityFilter(ExplorationProperties props) {
        return new VolatilityFilter(props.getVolatilityPatterns());
    }

    @Bean
    public ScreenFingerprinter screenFingerprinter(VolatilityFilter volatilityFilter) {
        return new ScreenFingerprinter(volatilityFilter);
    }

    @Bean
    public ElementClassifier elementClassifier(ExplorationProperties props) {
        DangerousPatternRules rules = props.getDangerousRules().isEmpty()
                ? DangerousPatternRules.defaults()
                : new DangerousPatternRules(props.getDangerousRules().stream()
                        .map(r -> new DangerousPatternRules.Rule(r.getReason(), Pattern.compile(r.getPattern(), Pattern.CASE_INSENSITIVE)))
                        .toList());
        var loginPolicy = new CompoundLoginGatePolicy(
                props.getLoginKeywords(),
                props.getLoginMinSupportingSignals(),
                props.getLoginSearchLevels()
        );
        return new ElementClassifier(rules, loginPolicy);
    }

    @Bean
    public PermissionPromptDetector permissionPromptDetector(ExplorationProperties props) {
        return new PermissionPromptDetector(props.getPermissionPackages());
    }

    @Bean
    public ScrollRevealer scrollRevealer(ScreenFingerprinter fingerprinter, ExplorationProperties props) {
        return new ScrollRevealer(fingerprinter, props.getMaxScrollSteps());
    }

    @Bean
    public IdentityRegistry identityRegistry(Clock clock) {
        return new IdentityRegistry(clock);
    }

    @Bean
    public AliasIndex aliasIndex(ExplorationProperties props) {
        return new AliasIndex(props.getAliasSimilarityThreshold());
    }

    @Bean
    public AutoAliasGenerator autoAliasGenerator() {
        return new AutoAliasGenerator();
    }

    @Bean
    public NavigationGraphBuilder navigationGraphBuilder(Clock clock) {
        return new NavigationGraphBuilder(clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(TreeSnapshotSource.class)
    public PlaywrightTreeSnapshotSource treeSnapshotSource(ExplorationProperties props) {
        return new PlaywrightTreeSnapshotSource(props.getBrowser(), props.getDispatchTimeout());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService explorationExecutor(ExplorationProperties props) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, props.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "exploration-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ExplorationEngine explorationEngine(
            TreeSnapshotSource source,
            ScreenFingerprinter fingerprinter,
            ElementClassifier classifier,
            PermissionPromptDetector permissionPromptDetector,
            ScrollRevealer scrollRevealer,
            IdentityRegistry identityRegistry,
            AliasIndex aliasIndex,
            AutoAliasGenerator autoAliasGenerator,
            NavigationGraphBuilder graphBuilder,
            PersistenceStore persistenceStore,
            List<ExplorationListener> listeners,
            ExplorationProperties props,
            ExecutorService explorationExecutor,
            Clock clock
    ) {
        return new ExplorationEngine(
                source,
                fingerprinter,
                classifier,
                permissionPromptDetector,
                scrollRevealer,
                identityRegistry,
                aliasIndex,
                autoAliasGenerator,
                graphBuilder,
                persistenceStore,
                ExplorationListener.composite(listeners),
                props.toEngineSettings(),
                explorationExecutor,
                clock
        );
    }
}
