package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Command-line options of the runner and their conversion into a {@link JobRequest}.
 */
public final class CliArguments {
    public static final String DEFAULT_OUTDIR = "downloads/";
    public static final String DEFAULT_REGION = "3:146142335-146301179";
    public static final String DEFAULT_GENOTYPE_URL = "https://ftp.ensembl.org/pub/data_files/homo_sapiens/GRCh38/variation_genotype/ALL.chr1_GRCh38.genotypes.20170504.vcf.gz";
    public static final String DEFAULT_MAPPING_URL = "https://ftp.1000genomes.ebi.ac.uk/vol1/ftp/release/20130502/integrated_call_samples_v3.20130502.ALL.panel";
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public static final String USAGE = String.join("\n",
        "Usage: ensembl-data-slicer [options]",
        "Get a subset of data from a BAM or VCF file through the Ensembl Data Slicer.",
        "  -o,  --outdir DIR          Output directory (default " + DEFAULT_OUTDIR + ")",
        "  -j,  --jobname NAME        Name for this job (default slice_<timestamp>)",
        "  -ff, --fileformat FORMAT   File format, BAM or VCF (default VCF)",
        "  -r,  --regionlookup REGION Region chrom:start-end (default " + DEFAULT_REGION + ")",
        "  -g,  --genotype URL        Genotype or alignment file URL",
        "  -f,  --filters FILTER      null, individuals, or populations (default populations)",
        "  -m,  --mapping URL         Sample-population mapping file URL",
        "  -p,  --populations CODES   Comma separated population codes (default CEU)",
        "  -i,  --individuals IDS     Comma separated individuals (individuals filter)",
        "  -to, --timeout SECONDS     Job timeout in seconds (default " + DEFAULT_TIMEOUT_SECONDS + ")",
        "       --open                Show the browser window",
        "  -h,  --help                Print this help");

    private static final Set<String> OPTIONS = Set.of(
        "-h", "--help", "--open", "-o", "--outdir", "-j", "--jobname", "-ff", "--fileformat",
        "-r", "--regionlookup", "-g", "--genotype", "-f", "--filters", "-m", "--mapping",
        "-p", "--populations", "-i", "--individuals", "-to", "--timeout");

    private Path outdir = Paths.get(DEFAULT_OUTDIR);
    private String jobName;
    private String fileFormat = "VCF";
    private String region = DEFAULT_REGION;
    private String genotype = DEFAULT_GENOTYPE_URL;
    private String filters = "populations";
    private String mapping = DEFAULT_MAPPING_URL;
    private String populations = "CEU";
    private String individuals = "";
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    private boolean open;
    private boolean help;

    private CliArguments() {}

    /**
     * Parses command-line arguments.
     * @throws IllegalArgumentException on unknown options, missing values, or malformed numbers
     */
    public static CliArguments parse(String[] args) {
        CliArguments a = new CliArguments();
        List<String> list = args == null ? List.of() : Arrays.asList(args);
        for (int i = 0; i < list.size(); i++) {
            String opt = list.get(i);
            switch (opt) {
                case "-h":
                case "--help":
                    a.help = true;
                    break;
                case "--open":
                    a.open = true;
                    break;
                case "-o":
                case "--outdir":
                    a.outdir = Paths.get(value(list, ++i, opt));
                    break;
                case "-j":
                case "--jobname":
                    a.jobName = value(list, ++i, opt);
                    break;
                case "-ff":
                case "--fileformat":
                    a.fileFormat = value(list, ++i, opt);
                    break;
                case "-r":
                case "--regionlookup":
                    a.region = value(list, ++i, opt);
                    break;
                case "-g":
                case "--genotype":
                    a.genotype = value(list, ++i, opt);
                    break;
                case "-f":
                case "--filters":
                    a.filters = value(list, ++i, opt);
                    break;
                case "-m":
                case "--mapping":
                    a.mapping = value(list, ++i, opt);
                    break;
                case "-p":
                case "--populations":
                    a.populations = value(list, ++i, opt);
                    break;
                case "-i":
                case "--individuals":
                    a.individuals = value(list, ++i, opt);
                    break;
                case "-to":
                case "--timeout":
                    String raw = value(list, ++i, opt);
                    try {
                        a.timeoutSeconds = Integer.parseInt(raw.trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Timeout must be a whole number of seconds but was '" + raw + "'");
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + opt);
            }
        }
        return a;
    }

    private static String value(List<String> args, int index, String opt) {
        if (index >= args.size() || args.get(index).startsWith("--") || OPTIONS.contains(args.get(index))) {
            throw new IllegalArgumentException("Option " + opt + " requires a value");
        }
        return args.get(index);
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split("[,\\s]+")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    public boolean helpRequested() {
        return help;
    }

    /**
     * Builds the validated request. A missing job name becomes {@code slice_yyyyMMdd_HHmmss}.
     * @throws IllegalArgumentException if any value fails JobRequest validation
     */
    public JobRequest toJobRequest(Clock clock) {
        String name = jobName;
        if (name == null || name.isBlank()) {
            name = "slice_" + LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        }
        return JobRequest.builder()
            .outputDirectory(outdir.toAbsolutePath())
            .jobName(name)
            .fileFormat(FileFormat.fromLabel(fileFormat))
            .region(region)
            .sourceUrl(genotype)
            .filterMode(FilterMode.fromFormValue(filters))
            .mappingUrl(mapping)
            .populations(splitList(populations))
            .individuals(splitList(individuals))
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .headless(!open)
            .build();
    }
}
