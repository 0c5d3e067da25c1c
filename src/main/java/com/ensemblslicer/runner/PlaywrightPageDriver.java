package com.ensemblslicer.runner;

import com.microsoft.playwright.Download;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.SelectOption;
import com.microsoft.playwright.options.WaitForSelectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@link PageDriver} backed by a single Playwright {@link Page}.
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class PlaywrightPageDriver implements PageDriver {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageDriver.class);

    private final Page page;

    public PlaywrightPageDriver(Page page) {
        if (page == null) {
            throw new IllegalArgumentException("Page cannot be null");
        }
        this.page = page;
    }

    @Override
    public void navigate(String url) {
        page.navigate(url);
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
    }

    @Override
    public String title() {
        try {
            String t = page.title();
            return t == null ? "" : t.trim();
        } catch (PlaywrightException e) {
            logger.debug("Failed to read page title: {}", e.getMessage());
            return "";
        }
    }

    @Override
    public boolean waitForVisible(String selector, Duration timeout) {
        return waitForState(selector, WaitForSelectorState.VISIBLE, timeout);
    }

    @Override
    public boolean waitForHidden(String selector, Duration timeout) {
        return waitForState(selector, WaitForSelectorState.HIDDEN, timeout);
    }

    private boolean waitForState(String selector, WaitForSelectorState state, Duration timeout) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                .setState(state)
                .setTimeout(timeout.toMillis()));
            return true;
        } catch (PlaywrightException e) {
            logger.debug("Selector '{}' not {} after {} ms: {}", selector, state, timeout.toMillis(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isVisible(String selector) {
        try {
            Locator l = page.locator(selector);
            return l.count() > 0 && l.first().isVisible();
        } catch (PlaywrightException e) {
            // the page may be mid-navigation while the job status refreshes
            logger.debug("Visibility check failed for '{}': {}", selector, e.getMessage());
            return false;
        }
    }

    @Override
    public String textOf(String selector) {
        try {
            Locator l = page.locator(selector);
            if (l.count() > 0) {
                String s = l.first().innerText();
                return s == null ? "" : s.trim();
            }
        } catch (PlaywrightException e) {
            logger.debug("Failed to get inner text for '{}': {}", selector, e.getMessage());
        }
        return "";
    }

    @Override
    public void fill(String selector, String value) {
        Locator l = page.locator(selector).first();
        l.scrollIntoViewIfNeeded();
        l.fill(value);
    }

    @Override
    public void selectOptions(String selector, List<String> labels) {
        SelectOption[] options = labels.stream()
            .map(label -> new SelectOption().setLabel(label))
            .toArray(SelectOption[]::new);
        List<String> selected = page.locator(selector).first().selectOption(options);
        if (selected.size() < labels.size()) {
            throw new PlaywrightException("Only " + selected.size() + " of " + labels.size() + " options " + labels + " could be selected");
        }
    }

    @Override
    public void click(String selector) {
        Locator l = page.locator(selector).first();
        l.scrollIntoViewIfNeeded();
        l.click();
    }

    /**
     * Waits at most {@code timeout} for the download event. {@link Download#saveAs} then blocks until the browser
     * has received the whole file and has no timeout of its own.
     */
    @Override
    public Path download(String selector, Path directory, String filenamePrefix, Duration timeout) {
        Download download = page.waitForDownload(
            new Page.WaitForDownloadOptions().setTimeout(timeout.toMillis()),
            () -> page.locator(selector).first().click());
        String name = filenamePrefix + Utils.sanitizeFilename(download.suggestedFilename());
        Path target = directory.resolve(name);
        logger.info("Download started: {} -> {}", download.suggestedFilename(), target);
        download.saveAs(target);
        String failure = download.failure();
        if (failure != null) {
            throw new PlaywrightException("Download of " + download.suggestedFilename() + " failed: " + failure);
        }
        return target;
    }
}
