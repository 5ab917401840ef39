package com.dubbi.screentrail.platform.web;

import com.dubbi.screentrail.config.ExplorationProperties;
import com.dubbi.screentrail.explore.snapshot.ActionKind;
import com.dubbi.screentrail.explore.snapshot.Bounds;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import com.dubbi.screentrail.explore.snapshot.TreeSnapshotSource;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 웹 페이지를 탐색 대상 "앱"으로 다루는 Playwright 바인딩.
 * appId는 페이지 host이고, handle은 위치 기반 CSS 경로다.
 *
 * <p>Playwright 객체는 만든 스레드에서만 써야 하므로 모든 호출을 전용 스레드 하나에서 실행한다.
 */
public class PlaywrightTreeSnapshotSource implements TreeSnapshotSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightTreeSnapshotSource.class);

    static final String UNKNOWN_VERSION = "unknown";

    private static final String SNAPSHOT_SCRIPT = """
            () => {
              const MAX_DEPTH = 40;
              const CLICKABLE_TAGS = new Set(['a', 'button', 'summary', 'select', 'option', 'label']);
              const CLICKABLE_ROLES = new Set(['button', 'link', 'menuitem', 'tab', 'checkbox', 'radio', 'switch', 'option', 'treeitem']);
              const NON_TEXT_INPUTS = new Set(['button', 'submit', 'checkbox', 'radio', 'hidden', 'reset', 'image', 'file', 'range', 'color']);

              const cssPath = (el) => {
                const parts = [];
                while (el && el.nodeType === 1 && el !== document.documentElement) {
                  let part = el.tagName.toLowerCase();
                  const parent = el.parentElement;
                  if (parent) {
                    const same = Array.from(parent.children).filter(c => c.tagName === el.tagName);
                    if (same.length > 1) part += ':nth-of-type(' + (same.indexOf(el) + 1) + ')';
                  }
                  parts.unshift(part);
                  el = parent;
                }
                return parts.length ? 'html > ' + parts.join(' > ') : 'html';
              };

              const ownText = (el) => Array.from(el.childNodes)
                .filter(n => n.nodeType === 3)
                .map(n => n.textContent)
                .join(' ')
                .replace(/\\s+/g, ' ')
                .trim()
                .slice(0, 200);

              const walk = (el, depth, parentPointer) => {
                if (depth > MAX_DEPTH) return null;
                const style = getComputedStyle(el);
                if (style.display === 'none' || style.visibility === 'hidden') return null;
                const tag = el.tagName.toLowerCase();
                if (tag === 'script' || tag === 'style' || tag === 'noscript' || tag === 'template') return null;

                const role = el.getAttribute('role');
                const type = (el.getAttribute('type') || '').toLowerCase();
                const editable = (tag === 'input' && !NON_TEXT_INPUTS.has(type)) || tag === 'textarea' || el.isContentEditable;
                const pointer = style.cursor === 'pointer';
                const clickable = CLICKABLE_TAGS.has(tag) || CLICKABLE_ROLES.has(role)
                  || el.hasAttribute('onclick') || (pointer && !parentPointer)
                  || (tag === 'input' && (type === 'submit' || type === 'button' || type === 'checkbox' || type === 'radio'));
                const scrollable = (style.overflowY === 'auto' || style.overflowY === 'scroll') && el.scrollHeight > el.clientHeight + 1;
                const r = el.getBoundingClientRect();

                const children = [];
                for (const child of Array.from(el.children)) {
                  const c = walk(child, depth + 1, pointer);
                  if (c) children.push(c);
                }
                return {
                  handle: cssPath(el),
                  type: role ? tag + ':' + role : tag,
                  text: tag === 'input' ? '' : ownText(el),
                  label: el.getAttribute('aria-label') || el.getAttribute('title') || el.getAttribute('alt') || el.getAttribute('placeholder') || '',
                  resource: el.id || el.getAttribute('data-testid') || el.getAttribute('name') || '',
                  left: Math.round(r.left), top: Math.round(r.top), right: Math.round(r.right), bottom: Math.round(r.bottom),
                  clickable: clickable,
                  focusable: el.tabIndex >= 0,
                  scrollable: scrollable,
                  editable: editable,
                  password: tag === 'input' && type === 'password',
                  enabled: !el.disabled,
                  children: children
                };
              };

              const meta = document.querySelector('meta[name="app-version"]');
              return {
                title: document.title || '',
                appVersion: meta ? meta.getAttribute('content') : '',
                root: document.body ? walk(document.body, 0, false) : null
              };
            }
            """;

    private static final String SCROLL_SCRIPT = """
            (el, dir) => {
              const target = (el === document.body || el === document.documentElement) ? document.scrollingElement : el;
              const before = target.scrollTop;
              target.scrollBy(0, dir * Math.max(40, target.clientHeight * 0.8));
              return target.scrollTop !== before;
            }
            """;

    private final ExplorationProperties.Browser browserSettings;
    private final double actionTimeoutMs;
    private final ExecutorService playwrightThread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "playwright");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, Page> pagesByAppId = new ConcurrentHashMap<>();

    // only touched on the playwright thread
    private Playwright playwright;
    private Browser browser;

    public PlaywrightTreeSnapshotSource(ExplorationProperties.Browser browserSettings, Duration actionTimeout) {
        this.browserSettings = browserSettings;
        this.actionTimeoutMs = actionTimeout.toMillis();
    }

    @Override
    public CompletableFuture<Boolean> launch(String appId, String entryPoint) {
        return CompletableFuture.supplyAsync(() -> {
            Page page = pagesByAppId.computeIfAbsent(appId, k -> newPage());
            String url = entryPoint == null || entryPoint.isBlank() ? "https://" + appId + "/" : entryPoint;
            Response response = page.navigate(url);
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            int status = response == null ? 0 : response.status();
            log.info("[Playwright] opened {} for {} (status={})", url, appId, status);
            return response == null || status < 400;
        }, playwrightThread);
    }

    @Override
    public CompletableFuture<ScreenSnapshot> readSnapshot(String appId) {
        return CompletableFuture.supplyAsync(() -> {
            Page page = requirePage(appId);
            Object raw = page.evaluate(SNAPSHOT_SCRIPT);
            return toScreenSnapshot(hostOf(page.url()), raw);
        }, playwrightThread);
    }

    @Override
    public CompletableFuture<Boolean> dispatchAction(String appId, String handle, ActionKind kind) {
        return CompletableFuture.supplyAsync(() -> {
            Page page = requirePage(appId);
            return switch (kind) {
                case CLICK -> {
                    page.locator(handle).first().click(new Locator.ClickOptions().setTimeout(actionTimeoutMs));
                    page.waitForLoadState(LoadState.DOMCONTENTLOADED);
                    yield true;
                }
                case BACK -> goBack(page, actionTimeoutMs);
                case SCROLL_FORWARD -> scroll(page, handle, 1);
                case SCROLL_BACKWARD -> scroll(page, handle, -1);
            };
        }, playwrightThread);
    }

    @Override
    public void close() {
        CompletableFuture<Void> shutdown = CompletableFuture.runAsync(() -> {
            pagesByAppId.values().forEach(p -> p.context().close());
            pagesByAppId.clear();
            if (browser != null) browser.close();
            if (playwright != null) playwright.close();
            browser = null;
            playwright = null;
        }, playwrightThread);
        try {
            shutdown.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Playwright] interrupted while closing browser");
        } catch (java.util.concurrent.ExecutionException e) {
            log.warn("[Playwright] closing browser failed: {}", e.getCause().getMessage());
        } finally {
            playwrightThread.shutdownNow();
        }
    }

    private Page newPage() {
        if (playwright == null) {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(browserSettings.isHeadless()));
        }
        BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(browserSettings.getViewportWidth(), browserSettings.getViewportHeight()));
        Page page = context.newPage();
        page.setDefaultTimeout(actionTimeoutMs);
        return page;
    }

    private Page requirePage(String appId) {
        Page page = pagesByAppId.get(appId);
        if (page == null) throw new IllegalStateException("no page open for " + appId + "; start the exploration with an entry url");
        return page;
    }

    static boolean goBack(Page page, double timeoutMs) {
        String before = page.url();
        Response response = page.goBack(new Page.GoBackOptions().setTimeout(timeoutMs));
        // null response: no history entry, or a same-document/cached navigation that did change the url
        return response != null || !Objects.equals(before, page.url());
    }

    private static boolean scroll(Page page, String handle, int direction) {
        Object moved = page.locator(handle == null ? "html" : handle).first().evaluate(SCROLL_SCRIPT, direction);
        return Boolean.TRUE.equals(moved);
    }

    static String hostOf(String url) {
        if (url == null) return null;
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            log.debug("[Playwright] unparsable page url {}", url);
            return null;
        }
    }

    static ScreenSnapshot toScreenSnapshot(String foregroundAppId, Object raw) {
        if (!(raw instanceof Map<?, ?> m)) return new ScreenSnapshot(foregroundAppId, UNKNOWN_VERSION, null, null);
        String version = str(m.get("appVersion"));
        return new ScreenSnapshot(
                foregroundAppId,
                version.isBlank() ? UNKNOWN_VERSION : version,
                str(m.get("title")),
                toElement(m.get("root"))
        );
    }

    static ElementSnapshot toElement(Object raw) {
        if (!(raw instanceof Map<?, ?> m)) return null;
        List<ElementSnapshot> children = new ArrayList<>();
        if (m.get("children") instanceof List<?> list) {
            for (Object item : list) {
                ElementSnapshot child = toElement(item);
                if (child != null) children.add(child);
            }
        }
        return ElementSnapshot.builder(str(m.get("type")))
                .handle(str(m.get("handle")))
                .text(blankToNull(str(m.get("text"))))
                .label(blankToNull(str(m.get("label"))))
                .resourceTag(blankToNull(str(m.get("resource"))))
                .bounds(new Bounds(num(m.get("left")), num(m.get("top")), num(m.get("right")), num(m.get("bottom"))))
                .clickable(bool(m.get("clickable")))
                .focusable(bool(m.get("focusable")))
                .scrollable(bool(m.get("scrollable")))
                .editable(bool(m.get("editable")))
                .password(bool(m.get("password")))
                .enabled(m.get("enabled") == null || bool(m.get("enabled")))
                .children(children)
                .build();
    }

    private static String str(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v;
    }

    private static int num(Object v) {
        return v instanceof Number n ? n.intValue() : 0;
    }

    private static boolean bool(Object v) {
        return v instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(v));
    }
}
