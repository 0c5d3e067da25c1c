package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Scriptable in-memory PageDriver. Every form control is ready unless listed in {@link #neverReady};
 * monitor-facing visibility is driven by {@link #visibility}.
 */
class FakePageDriver implements PageDriver {
    interface DownloadAction {
        Path download(Path directory, String prefix) throws Exception;
    }

    final List<String> actions = new ArrayList<>();
    final List<String> awaited = new ArrayList<>();
    final Set<String> neverReady = new HashSet<>();
    final Map<String, String> texts = new HashMap<>();
    final Map<String, Integer> isVisibleCalls = new HashMap<>();
    Predicate<String> visibility = selector -> false;
    DownloadAction downloadAction = (dir, prefix) -> dir.resolve(prefix + "unused");
    RuntimeException failOnFill;

    @Override
    public void navigate(String url) {
        actions.add("navigate:" + url);
    }

    @Override
    public String title() {
        return "Data Slicer - Homo_sapiens - Ensembl";
    }

    @Override
    public boolean waitForVisible(String selector, Duration timeout) {
        awaited.add(selector);
        return !neverReady.contains(selector);
    }

    @Override
    public boolean waitForHidden(String selector, Duration timeout) {
        return true;
    }

    @Override
    public boolean isVisible(String selector) {
        isVisibleCalls.merge(selector, 1, Integer::sum);
        return visibility.test(selector);
    }

    @Override
    public String textOf(String selector) {
        return texts.getOrDefault(selector, "");
    }

    @Override
    public void fill(String selector, String value) {
        if (failOnFill != null) throw failOnFill;
        actions.add("fill:" + selector + "=" + value);
    }

    @Override
    public void selectOptions(String selector, List<String> labels) {
        actions.add("select:" + selector + "=" + String.join(",", labels));
    }

    @Override
    public void click(String selector) {
        actions.add("click:" + selector);
    }

    @Override
    public Path download(String selector, Path directory, String filenamePrefix, Duration timeout) {
        actions.add("download:" + selector);
        try {
            return downloadAction.download(directory, filenamePrefix);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    long countActionsStartingWith(String prefix) {
        return actions.stream().filter(a -> a.startsWith(prefix)).count();
    }
}
