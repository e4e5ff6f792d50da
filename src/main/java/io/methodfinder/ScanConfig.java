package io.methodfinder;

import io.methodfinder.output.OutputFormat;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration loaded from a YAML file.
 * <p>
 * Every key is optional; a value left out here falls back to the command line default.
 * <pre>
 * targetClass: java.lang.String
 * targetMethod: toString
 * scanFolder: build/classes
 * format: json
 * threads: 4
 * exclude:
 *   - "com.example.generated.**"
 * includeTargetClass: false
 * </pre>
 */
public class ScanConfig {

    private static final ScanConfig EMPTY = new ScanConfig(null, null, null, null, null, List.of(), null);

    private final String targetClass;
    private final String targetMethod;
    private final Path scanFolder;
    private final OutputFormat format;
    private final Integer threads;
    private final List<String> exclude;
    private final Boolean includeTargetClass;

    private ScanConfig(String targetClass,
                       String targetMethod,
                       Path scanFolder,
                       OutputFormat format,
                       Integer threads,
                       List<String> exclude,
                       Boolean includeTargetClass) {
        this.targetClass = targetClass;
        this.targetMethod = targetMethod;
        this.scanFolder = scanFolder;
        this.format = format;
        this.threads = threads;
        this.exclude = exclude;
        this.includeTargetClass = includeTargetClass;
    }

    /**
     * A configuration with nothing set.
     */
    public static ScanConfig empty() {
        return EMPTY;
    }

    /**
     * Load configuration from a YAML file.
     *
     * @throws IOException if the file cannot be read or holds invalid values
     */
    public static ScanConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object document;
            try {
                document = yaml.load(in);
            } catch (YAMLException e) {
                throw new IOException("Invalid YAML in " + configPath + ": " + e.getMessage(), e);
            }
            if (!(document instanceof Map<?, ?> data)) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }

            String scanFolder = string(data, "scanFolder");
            String format = string(data, "format");
            Integer threads = integer(data, "threads");
            if (threads != null && threads < 1) {
                throw new IOException("Config key 'threads' must be at least 1, was " + threads);
            }

            OutputFormat outputFormat;
            try {
                outputFormat = format != null ? OutputFormat.parse(format) : null;
            } catch (IllegalArgumentException e) {
                throw new IOException("Config key 'format': " + e.getMessage(), e);
            }

            return new ScanConfig(
                string(data, "targetClass"),
                string(data, "targetMethod"),
                scanFolder != null ? Path.of(scanFolder) : null,
                outputFormat,
                threads,
                stringList(data, "exclude"),
                bool(data, "includeTargetClass")
            );
        }
    }

    private static String string(Map<?, ?> data, String key) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new IOException("Config key '" + key + "' must be a string");
        }
        return s.isBlank() ? null : s.trim();
    }

    private static Integer integer(Map<?, ?> data, String key) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer i)) {
            throw new IOException("Config key '" + key + "' must be an integer");
        }
        return i;
    }

    private static Boolean bool(Map<?, ?> data, String key) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean b)) {
            throw new IOException("Config key '" + key + "' must be true or false");
        }
        return b;
    }

    private static List<String> stringList(Map<?, ?> data, String key) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IOException("Config key '" + key + "' must be a list");
        }
        return list.stream()
            .filter(s -> s != null && !s.toString().trim().isEmpty())
            .map(s -> s.toString().trim())
            .toList();
    }

    /** Target class, or null if not configured. */
    public String getTargetClass() {
        return targetClass;
    }

    /** Target method, or null if not configured. */
    public String getTargetMethod() {
        return targetMethod;
    }

    /** Scan root, or null if not configured. */
    public Path getScanFolder() {
        return scanFolder;
    }

    /** Output format, or null if not configured. */
    public OutputFormat getFormat() {
        return format;
    }

    /** Worker count, or null if not configured. */
    public Integer getThreads() {
        return threads;
    }

    public List<String> getExclude() {
        return exclude;
    }

    /** Whether to report calls from the target class itself, or null if not configured. */
    public Boolean getIncludeTargetClass() {
        return includeTargetClass;
    }
}
