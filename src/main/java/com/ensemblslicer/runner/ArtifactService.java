package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Requests the result download of a completed job and confirms the file landed in the download directory.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens the results view and clicks the download link. Failures here are logged; the directory decides.</li>
 *   <li>Polls the download directory for a file that was not there when the session opened, or that has been
 *   rewritten since. The path the browser reported for the download is checked first.</li>
 *   <li>Returns the best candidate once its size is non-zero and unchanged across two consecutive checks.</li>
 * </ul>
 * Candidate ranking: the reported download path, then name contains the job name, then carries the format's
 * extension, then most recently modified. In-progress downloads ({@code .part}, {@code .crdownload}, {@code .download}, {@code .tmp}) are ignored.
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class ArtifactService {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactService.class);
    private static final List<String> PARTIAL_SUFFIXES = List.of(".part", ".crdownload", ".download", ".tmp");

    private final SlicerConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    public ArtifactService(SlicerConfig config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public ArtifactService(SlicerConfig config, Clock clock, Sleeper sleeper) {
        this.config = config == null ? SlicerConfig.defaults() : config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Retrieves the result file of a completed job.
     * @param session Session that ran the job
     * @param request Request the job was submitted with
     * @param state State reported by the completion monitor; must be COMPLETED
     * @return Artifact whose size has stopped changing
     * @throws ArtifactNotFoundException if no stable file appears within the download wait
     */
    public Artifact fetchResult(BrowserSession session, JobRequest request, JobState state) {
        if (state != JobState.COMPLETED) {
            throw new IllegalStateException("Result can only be fetched for a COMPLETED job, not " + state);
        }
        Path reported = requestDownload(session, request);
        return awaitArtifact(session, request, reported);
    }

    /**
     * @return Path the browser saved the download to, or null if the download could not be triggered
     */
    private Path requestDownload(BrowserSession session, JobRequest request) {
        PageDriver driver = session.driver();
        try {
            logger.info("Opening results...");
            driver.click(FormFieldRegistry.VIEW_RESULTS);
            if (!driver.waitForVisible(FormFieldRegistry.DOWNLOAD_RESULTS, config.fieldWait())) {
                logger.warn("Download link did not appear after {}", Utils.formatDuration(config.fieldWait()));
                return null;
            }
            logger.info("Downloading results...");
            Path saved = driver.download(FormFieldRegistry.DOWNLOAD_RESULTS, session.downloadDirectory(),
                filePrefix(request), config.downloadWait());
            logger.info("Download saved to {}", saved);
            return saved;
        } catch (RuntimeException e) {
            logger.warn("Download request did not complete cleanly: {}", e.getMessage());
            return null;
        }
    }

    Artifact awaitArtifact(BrowserSession session, JobRequest request, Path reported) {
        Path dir = session.downloadDirectory();
        long start = clock.millis();
        long deadline = start + config.downloadWait().toMillis();
        Path lastPath = null;
        long lastSize = -1;
        while (true) {
            Path candidate = findCandidate(session, request, reported);
            if (candidate != null) {
                long size = sizeOf(candidate);
                if (candidate.equals(lastPath) && size > 0 && size == lastSize) {
                    logger.info("Artifact ready: {} ({} bytes)", candidate.getFileName(), size);
                    return new Artifact(candidate, size, request.fileFormat());
                }
                logger.debug("Candidate {} at {} bytes; waiting for it to settle", candidate.getFileName(), size);
                lastPath = candidate;
                lastSize = size;
            }
            long now = clock.millis();
            if (now >= deadline) {
                throw new ArtifactNotFoundException(dir, Duration.ofMillis(now - start));
            }
            try {
                sleeper.sleep(Duration.ofMillis(Math.min(config.stabilityCheckInterval().toMillis(), deadline - now)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArtifactNotFoundException(dir, Duration.ofMillis(clock.millis() - start));
            }
        }
    }

    /**
     * Picks the most plausible new or rewritten file for this request, or null if there is none yet.
     */
    Path findCandidate(BrowserSession session, JobRequest request, Path reported) {
        String reportedName = reported == null || reported.getFileName() == null ? null : reported.getFileName().toString();
        String jobToken = Utils.sanitizeFilename(request.jobName()).toLowerCase(Locale.ROOT);
        List<Path> fresh = new ArrayList<>();
        try (Stream<Path> files = Files.list(session.downloadDirectory())) {
            files.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().equals(reportedName) || !session.isUnchangedSinceOpen(p))
                .filter(p -> !isPartial(p.getFileName().toString()))
                .forEach(fresh::add);
        } catch (IOException e) {
            logger.warn("Failed to list download directory {}: {}", session.downloadDirectory(), e.getMessage());
            return null;
        }
        Comparator<Path> byRank = Comparator
            .comparing((Path p) -> p.getFileName().toString().equals(reportedName))
            .thenComparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).contains(jobToken))
            .thenComparing(p -> request.fileFormat().matchesExtension(p.getFileName().toString()))
            .thenComparing(ArtifactService::modifiedTime);
        return fresh.stream().max(byRank).orElse(null);
    }

    static String filePrefix(JobRequest request) {
        return Utils.sanitizeFilename(request.jobName()) + "_";
    }

    private static boolean isPartial(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String suffix : PARTIAL_SUFFIXES) {
            if (lower.endsWith(suffix)) return true;
        }
        return false;
    }

    private static long sizeOf(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            // the browser may rename the file between listing and sizing
            return -1;
        }
    }

    private static FileTime modifiedTime(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
