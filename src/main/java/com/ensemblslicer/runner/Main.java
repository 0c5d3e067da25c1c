package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.time.Clock;

/**
 * Main entry point for the Ensembl Data Slicer runner.
 * This application fills in the Data Slicer form in a real browser, waits for the job, and downloads the result.
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    public static final String VERSION = "1.0.0";

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int code = run(args, SlicerConfig.fromEnv(), System.out);
        System.exit(code);
    }

    /**
     * Parses arguments, prepares the output directory, and runs the job.
     * @return Process exit code, see {@link RunOutcome#exitCode()}
     */
    static int run(String[] args, SlicerConfig config, PrintStream out) {
        CliArguments cli;
        JobRequest request;
        try {
            cli = CliArguments.parse(args);
            if (cli.helpRequested()) {
                out.println(CliArguments.USAGE);
                return 0;
            }
            request = cli.toJobRequest(Clock.systemDefaultZone());
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            out.println(CliArguments.USAGE);
            return RunOutcome.INVALID_REQUEST.exitCode();
        }

        logger.info("ENSEMBL Data Slicer runner v{}", VERSION);
        logger.debug("Configuration: {}", config);
        try {
            Files.createDirectories(request.outputDirectory());
        } catch (IOException e) {
            logger.error("Cannot create output directory {}: {}", request.outputDirectory(), e.getMessage());
            return RunOutcome.ENVIRONMENT_ERROR.exitCode();
        }

        return execute(new DataSlicerJobRunner(config), request);
    }

    static int execute(DataSlicerJobRunner runner, JobRequest request) {
        try {
            Artifact artifact = runner.run(request);
            logger.info("Completed. Result file: {} ({} bytes)", artifact.path(), artifact.sizeBytes());
            return RunOutcome.COMPLETED.exitCode();
        } catch (SlicerException e) {
            RunOutcome outcome = RunOutcome.of(e);
            logger.error("{}: {}", outcome, e.getMessage());
            return outcome.exitCode();
        } catch (RuntimeException e) {
            RunOutcome outcome = RunOutcome.of(e);
            logger.error("{}: {}", outcome, e.toString(), e);
            return outcome.exitCode();
        }
    }
}
