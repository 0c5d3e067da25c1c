package com.ensemblslicer.runner;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Playwright-backed session controller.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Checks the download directory exists and snapshots its contents.</li>
 *   <li>Starts Playwright and launches the configured engine, headless or visible.</li>
 *   <li>Creates a context that accepts downloads and opens a single page.</li>
 *   <li>On any launch failure, closes whatever was started and raises {@link EnvironmentException}.</li>
 * </ul>
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public final class BrowserSessionService implements BrowserSessionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(BrowserSessionService.class);

    public BrowserSessionService() {}

    @Override
    public BrowserSession open(SessionConfig config) {
        Path downloadDir = config.downloadDirectory() == null ? null : config.downloadDirectory().toAbsolutePath();
        Map<String, BrowserSession.FileStamp> existing = BrowserSession.snapshot(downloadDir);
        String engine = engineName(config.browser());
        logger.info("Opening browser ({}, {})...", engine, config.headless() ? "headless" : "visible");
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = browserType(playwright, engine)
                .launch(new BrowserType.LaunchOptions().setHeadless(config.headless()));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setAcceptDownloads(true)
                .setViewportSize(1920, 1080));
            context.setDefaultTimeout(config.actionTimeout().toMillis());
            Page page = context.newPage();
            page.setDefaultNavigationTimeout(config.actionTimeout().toMillis());
            return new BrowserSession(new PlaywrightPageDriver(page), downloadDir, existing, playwright::close);
        } catch (RuntimeException e) {
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (Exception closeError) {
                    logger.warn("Failed to release Playwright after launch error: {}", closeError.getMessage());
                }
            }
            logger.error("Failed to launch browser: {}", e.getMessage());
            throw new EnvironmentException("Browser '" + engine + "' could not be started: " + e.getMessage(), e);
        }
    }

    static String engineName(String name) {
        String engine = name == null || name.isBlank() ? "chromium" : name.trim().toLowerCase(java.util.Locale.ROOT);
        if (!engine.equals("chromium") && !engine.equals("firefox") && !engine.equals("webkit")) {
            throw new EnvironmentException("Unknown browser engine '" + name + "' (expected chromium, firefox, or webkit)");
        }
        return engine;
    }

    private static BrowserType browserType(Playwright playwright, String engine) {
        switch (engine) {
            case "firefox":
                return playwright.firefox();
            case "webkit":
                return playwright.webkit();
            default:
                return playwright.chromium();
        }
    }

    @Override
    public void close(BrowserSession session) {
        if (session != null) {
            session.close();
        }
    }
}
