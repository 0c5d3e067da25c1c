package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Web page automation capability used by the form, monitor, and artifact services.
 * <p>
 * Selectors use the Playwright selector syntax (CSS by default, {@code text=} and {@code :text-is()} supported).
 * Wait methods are bounded and report readiness as a boolean; action methods throw a {@link RuntimeException}
 * from the underlying driver when the element cannot be used.
 */
public interface PageDriver {
    /**
     * Navigates the page to a URL and waits for the load event.
     * @param url Absolute URL
     */
    void navigate(String url);

    /**
     * @return Current document title, or an empty string if unavailable
     */
    String title();

    /**
     * Waits until the first element matching the selector is visible.
     * @param selector Element selector
     * @param timeout Maximum wait
     * @return true if the element became visible within the timeout
     */
    boolean waitForVisible(String selector, Duration timeout);

    /**
     * Waits until no element matching the selector is visible (absent elements count as hidden).
     * @param selector Element selector
     * @param timeout Maximum wait
     * @return true if the element was hidden within the timeout
     */
    boolean waitForHidden(String selector, Duration timeout);

    /**
     * Non-blocking visibility check.
     */
    boolean isVisible(String selector);

    /**
     * Inner text of the first visible match, trimmed; empty string when nothing matches.
     */
    String textOf(String selector);

    /**
     * Replaces the value of a text input.
     */
    void fill(String selector, String value);

    /**
     * Selects options of a select element by their visible labels.
     */
    void selectOptions(String selector, List<String> labels);

    void click(String selector);

    /**
     * Clicks a link that starts a download and saves the file into {@code directory}. The saved name is
     * {@code filenamePrefix} followed by the server-suggested file name. {@code timeout} bounds the wait for the
     * download to start; copying the finished file may take longer.
     * @return Path the download was saved to
     */
    Path download(String selector, Path directory, String filenamePrefix, Duration timeout);
}
