package com.dubbi.screentrail.config;

import com.dubbi.screentrail.explore.classify.PermissionPromptDetector;
import com.dubbi.screentrail.explore.engine.EngineSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * screentrail.exploration.* 설정. 패턴 목록이 비어 있으면 내장 기본값을 쓴다.
 */
@ConfigurationProperties(prefix = "screentrail.exploration")
public class ExplorationProperties {
    private Duration readTimeout = Duration.ofMillis(1500);
    private Duration dispatchTimeout = Duration.ofMillis(1500);
    private Duration launchTimeout = Duration.ofSeconds(15);
    private Duration settleWindow = Duration.ofMillis(1500);
    private Duration settlePollInterval = Duration.ofMillis(250);
    private int maxSettleReads = 5;
    private int maxConsecutiveFailures = 3;
    private int maxExternalBackAttempts = 3;
    private int maxScrollSteps = 10;
    private double backSimilarityThreshold = 0.85;
    private double aliasSimilarityThreshold = 0.70;
    private int workerThreads = 2;
    private List<String> volatilityPatterns = new ArrayList<>();
    private List<DangerousRule> dangerousRules = new ArrayList<>();
    private List<String> loginKeywords = new ArrayList<>();
    private int loginMinSupportingSignals = 1;
    private int loginSearchLevels = 2;
    private List<String> permissionPackages = new ArrayList<>(PermissionPromptDetector.DEFAULT_PACKAGES);
    private Browser browser = new Browser();

    public static class DangerousRule {
        private String reason;
        private String pattern;

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }
    }

    /** 웹 대상용 Playwright 설정 */
    public static class Browser {
        private boolean headless = true;
        private int viewportWidth = 1280;
        private int viewportHeight = 800;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getViewportWidth() {
            return viewportWidth;
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = viewportWidth;
        }

        public int getViewportHeight() {
            return viewportHeight;
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = viewportHeight;
        }
    }

    public EngineSettings toEngineSettings() {
        return new EngineSettings(
                readTimeout,
                dispatchTimeout,
                launchTimeout,
                settleWindow,
                settlePollInterval,
                maxSettleReads,
                maxConsecutiveFailures,
                maxExternalBackAttempts,
                backSimilarityThreshold
        );
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public void setDispatchTimeout(Duration dispatchTimeout) {
        this.dispatchTimeout = dispatchTimeout;
    }

    public Duration getLaunchTimeout() {
        return launchTimeout;
    }

    public void setLaunchTimeout(Duration launchTimeout) {
        this.launchTimeout = launchTimeout;
    }

    public Duration getSettleWindow() {
        return settleWindow;
    }

    public void setSettleWindow(Duration settleWindow) {
        this.settleWindow = settleWindow;
    }

    public Duration getSettlePollInterval() {
        return settlePollInterval;
    }

    public void setSettlePollInterval(Duration settlePollInterval) {
        this.settlePollInterval = settlePollInterval;
    }

    public int getMaxSettleReads() {
        return maxSettleReads;
    }

    public void setMaxSettleReads(int maxSettleReads) {
        this.maxSettleReads = maxSettleReads;
    }

    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    public int getMaxExternalBackAttempts() {
        return maxExternalBackAttempts;
    }

    public void setMaxExternalBackAttempts(int maxExternalBackAttempts) {
        this.maxExternalBackAttempts = maxExternalBackAttempts;
    }

    public int getMaxScrollSteps() {
        return maxScrollSteps;
    }

    public void setMaxScrollSteps(int maxScrollSteps) {
        this.maxScrollSteps = maxScrollSteps;
    }

    public double getBackSimilarityThreshold() {
        return backSimilarityThreshold;
    }

    public void setBackSimilarityThreshold(double backSimilarityThreshold) {
        this.backSimilarityThreshold = backSimilarityThreshold;
    }

    public double getAliasSimilarityThreshold() {
        return aliasSimilarityThreshold;
    }

    public void setAliasSimilarityThreshold(double aliasSimilarityThreshold) {
        this.aliasSimilarityThreshold = aliasSimilarityThreshold;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public List<String> getVolatilityPatterns() {
        return volatilityPatterns;
    }

    public void setVolatilityPatterns(List<String> volatilityPatterns) {
        this.volatilityPatterns = volatilityPatterns;
    }

    public List<DangerousRule> getDangerousRules() {
        return dangerousRules;
    }

    public void setDangerousRules(List<DangerousRule> dangerousRules) {
        this.dangerousRules = dangerousRules;
    }

    public List<String> getLoginKeywords() {
        return loginKeywords;
    }

    public void setLoginKeywords(List<String> loginKeywords) {
        this.loginKeywords = loginKeywords;
    }

    public int getLoginMinSupportingSignals() {
        return loginMinSupportingSignals;
    }

    public void setLoginMinSupportingSignals(int loginMinSupportingSignals) {
        this.loginMinSupportingSignals = loginMinSupportingSignals;
    }

    public int getLoginSearchLevels() {
        return loginSearchLevels;
    }

    public void setLoginSearchLevels(int loginSearchLevels) {
        this.loginSearchLevels = loginSearchLevels;
    }

    public List<String> getPermissionPackages() {
        return permissionPackages;
    }

    public void setPermissionPackages(List<String> permissionPackages) {
        this.permissionPackages = permissionPackages;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }
}
