package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * One browser process and its download directory, owned by a single run.
 * <p>
 * The session remembers which files were already in the download directory when it opened, with their size
 * and modification time, so that the artifact lookup only considers files this run created or rewrote.
 * {@link #close()} is idempotent: the teardown action runs at most once.
 */
public final class BrowserSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BrowserSession.class);

    private final PageDriver driver;
    private final Path downloadDirectory;
    private final Map<String, FileStamp> preexistingFiles;
    private final AutoCloseable teardown;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Size and modification time of a file when the session opened.
     */
    public record FileStamp(long sizeBytes, long modifiedMillis) {
        static FileStamp of(Path file) throws IOException {
            return new FileStamp(Files.size(file), Files.getLastModifiedTime(file).toMillis());
        }
    }

    public BrowserSession(PageDriver driver, Path downloadDirectory, Map<String, FileStamp> preexistingFiles, AutoCloseable teardown) {
        this.driver = driver;
        this.downloadDirectory = downloadDirectory;
        this.preexistingFiles = Map.copyOf(preexistingFiles);
        this.teardown = teardown;
    }

    /**
     * Records every regular file currently present in a directory.
     * @throws EnvironmentException if the directory is missing or unreadable
     */
    public static Map<String, FileStamp> snapshot(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new EnvironmentException("Download directory does not exist: " + directory);
        }
        Map<String, FileStamp> stamps = new HashMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(p)) {
                    stamps.put(p.getFileName().toString(), FileStamp.of(p));
                }
            }
        } catch (IOException e) {
            throw new EnvironmentException("Cannot read download directory " + directory, e);
        }
        return stamps;
    }

    public PageDriver driver() {
        if (closed.get()) {
            throw new IllegalStateException("Browser session is already closed");
        }
        return driver;
    }

    public Path downloadDirectory() {
        return downloadDirectory;
    }

    public Set<String> preexistingFiles() {
        return preexistingFiles.keySet();
    }

    /**
     * True if the file was present when the session opened and still has the same size and modification time.
     */
    public boolean isUnchangedSinceOpen(Path file) {
        FileStamp before = preexistingFiles.get(file.getFileName().toString());
        if (before == null) return false;
        try {
            return before.equals(FileStamp.of(file));
        } catch (IOException e) {
            // vanished or being replaced: not the old file any more
            return false;
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Browser session already closed.");
            return;
        }
        try {
            teardown.close();
            logger.info("Browser closed.");
        } catch (Exception e) {
            logger.warn("Failed to close browser cleanly: {}", e.getMessage());
        }
    }
}
