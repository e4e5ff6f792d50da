package io.methodfinder;

import ch.qos.logback.classic.Level;
import io.methodfinder.model.ScanResult;
import io.methodfinder.model.TargetMethod;
import io.methodfinder.output.OutputFormat;
import io.methodfinder.output.Reporter;
import io.methodfinder.scan.ClassTreeScanner;
import io.methodfinder.scan.ScanInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for jmf, the Java Method Finder.
 */
@Command(
        name = "jmf",
        mixinStandardHelpOptions = true,
        version = "jmf 1.0.0",
        description = "Finds every call site of a method in a tree of compiled Java class files.",
        footer = {
                "",
                "Examples:",
                "  jmf -c java.lang.String -m toString",
                "  jmf -c com.example.TargetClass -m targetMethod -s build/classes/java/main -f json",
                "  jmf --config jmf.yaml -x 'com.example.generated.**'"
        }
)
public class MethodFinderCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MethodFinderCli.class);

    static final Path DEFAULT_SCAN_FOLDER = Path.of("./target/classes");

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-c", "--class"},
            description = "Fully qualified name of the class declaring the target method (e.g., java.lang.String)"
    )
    private String targetClass;

    @Option(
            names = {"-m", "--method"},
            description = "Name of the target method; all overloads match"
    )
    private String targetMethod;

    @Option(
            names = {"-s", "--scan"},
            description = "Directory of compiled classes to scan (default: ./target/classes)"
    )
    private Path scanFolder;

    @Option(
            names = {"-f", "--format"},
            description = "Output format: txt (default), json"
    )
    private OutputFormat format;

    @Option(
            names = {"-o", "--output-file"},
            description = "Write the report to this file instead of stdout"
    )
    private Path outputFile;

    @Option(
            names = {"-t", "--threads"},
            description = "Number of worker threads (default: available processors)"
    )
    private Integer threads;

    @Option(
            names = {"-x", "--exclude"},
            description = "Glob patterns of caller classes to skip (e.g., '**.Test*', 'com.example.internal.**')",
            split = ","
    )
    private List<String> excludePatterns;

    @Option(
            names = {"--include-target-class"},
            description = "Also report calls made from inside the target class itself"
    )
    private Boolean includeTargetClass;

    @Option(
            names = {"--config"},
            description = "Path to a YAML configuration file"
    )
    private Path configFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Override
    public Integer call() {
        configureLogging(verbose);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ScanConfig config;
        try {
            config = configFile != null ? ScanConfig.load(configFile) : ScanConfig.empty();
        } catch (IOException e) {
            err.println("Error: Cannot load config: " + e.getMessage());
            return 1;
        }

        String className = firstNonNull(targetClass, config.getTargetClass());
        String methodName = firstNonNull(targetMethod, config.getTargetMethod());
        if (className == null) {
            err.println("Error: No target class given (use -c/--class or 'targetClass' in the config file)");
            return 1;
        }
        if (methodName == null) {
            err.println("Error: No target method given (use -m/--method or 'targetMethod' in the config file)");
            return 1;
        }

        int workerCount = firstNonNull(threads, config.getThreads(), Runtime.getRuntime().availableProcessors());
        if (workerCount < 1) {
            err.println("Error: Invalid value for --threads: " + workerCount);
            return 1;
        }

        List<String> excludes = new ArrayList<>(config.getExclude());
        if (excludePatterns != null) {
            excludes.addAll(excludePatterns);
        }

        TargetMethod target = new TargetMethod(className.trim(), methodName.trim());
        Path root = firstNonNull(scanFolder, config.getScanFolder(), DEFAULT_SCAN_FOLDER);
        OutputFormat outputFormat = firstNonNull(format, config.getFormat(), OutputFormat.txt);
        boolean includeSelf = firstNonNull(includeTargetClass, config.getIncludeTargetClass(), Boolean.FALSE);

        ClassTreeScanner scanner = new ClassTreeScanner(target, workerCount, excludes, includeSelf);
        ScanResult result;
        try {
            result = scanner.scan(root);
        } catch (ScanInputException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }

        log.debug("Scanned {} class file(s): {} call(s), {} warning(s)",
                result.filesScanned(), result.calls().size(), result.warnings().size());

        Reporter reporter = Reporter.forFormat(outputFormat);
        try {
            if (outputFile != null) {
                reporter.write(target, result, outputFile);
                log.info("Report written to: {}", outputFile);
            } else {
                reporter.write(target, result, out);
            }
        } catch (IOException e) {
            err.println("Error writing report: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    /**
     * Raises the root log level to DEBUG in verbose mode; otherwise INFO.
     */
    static void configureLogging(boolean verbose) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(verbose ? Level.DEBUG : Level.INFO);
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Creates the configured command line, shared by {@link #main} and tests.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new MethodFinderCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
