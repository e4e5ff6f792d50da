package io.methodfinder.scan;

import io.methodfinder.bytecode.InvocationScanner;
import io.methodfinder.classfile.ClassFile;
import io.methodfinder.classfile.ClassFileFormatException;
import io.methodfinder.classfile.ClassFileParser;
import io.methodfinder.classfile.ResolutionException;
import io.methodfinder.model.FoundCall;
import io.methodfinder.model.ScanResult;
import io.methodfinder.model.ScanWarning;
import io.methodfinder.model.TargetMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Scans a directory tree of compiled classes for calls to a target method.
 * <p>
 * Every {@code .class} file under the root is parsed and scanned on a fixed worker pool. Each
 * task works only on its own file and returns its own calls and warnings; results are merged on
 * the calling thread once the task completes. A file that cannot be read or parsed becomes a
 * warning and never stops the scan.
 */
public class ClassTreeScanner {

    private static final Logger log = LoggerFactory.getLogger(ClassTreeScanner.class);

    private final TargetMethod target;
    private final int threads;
    private final List<Pattern> excludePatterns;
    private final InvocationScanner invocationScanner;

    /**
     * Creates a scanner that uses one thread per available processor and excludes nothing.
     */
    public ClassTreeScanner(TargetMethod target) {
        this(target, Runtime.getRuntime().availableProcessors(), List.of(), false);
    }

    /**
     * @param target             class and method to look for
     * @param threads            worker pool size, at least 1
     * @param excludePatterns    glob patterns on caller class names; {@code *} stays within a
     *                           package segment, {@code **} crosses segments
     * @param includeTargetClass whether calls from inside the target class are reported
     */
    public ClassTreeScanner(TargetMethod target, int threads, Collection<String> excludePatterns,
                            boolean includeTargetClass) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, was " + threads);
        }
        this.target = target;
        this.threads = threads;
        this.excludePatterns = excludePatterns.stream().map(ClassTreeScanner::globToRegex).toList();
        this.invocationScanner = new InvocationScanner(target, includeTargetClass);
    }

    /**
     * Scans every class file under {@code root}.
     *
     * @throws ScanInputException if the target is blank or the root is not an existing directory
     * @throws IOException        if the scan is interrupted
     */
    public ScanResult scan(Path root) throws ScanInputException, IOException {
        validate(root);
        log.debug("Start scanning folder: {}", root);

        List<ScanWarning> warnings = new ArrayList<>();
        List<Path> classFiles = discover(root, warnings);
        log.debug("Found {} class file(s) to analyze", classFiles.size());

        List<FoundCall> calls = new ArrayList<>();
        if (classFiles.isEmpty()) {
            return new ScanResult(calls, warnings, 0);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, classFiles.size()),
                new ScanThreadFactory());
        try {
            List<Future<FileScan>> futures = new ArrayList<>(classFiles.size());
            for (Path file : classFiles) {
                futures.add(executor.submit(() -> scanFile(file)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    FileScan fileScan = futures.get(i).get();
                    calls.addAll(fileScan.calls());
                    warnings.addAll(fileScan.warnings());
                } catch (ExecutionException e) {
                    warnings.add(warn(classFiles.get(i), "Unexpected failure: " + e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Scan of " + root + " interrupted", e);
        } finally {
            executor.shutdownNow();
        }

        return new ScanResult(calls, warnings, classFiles.size());
    }

    private void validate(Path root) throws ScanInputException {
        if (target.className() == null || target.className().isBlank()) {
            throw new ScanInputException("Target class must not be empty");
        }
        if (target.methodName() == null || target.methodName().isBlank()) {
            throw new ScanInputException("Target method must not be empty");
        }
        if (!Files.exists(root)) {
            throw new ScanInputException("Scan folder does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new ScanInputException("Scan path is not a directory: " + root);
        }
    }

    private List<Path> discover(Path root, List<ScanWarning> warnings) throws IOException {
        List<Path> classFiles = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.toString().endsWith(".class")) {
                    String className = pathToClassName(root.relativize(file).toString());
                    if (isExcluded(className)) {
                        log.debug("Excluded: {}", className);
                    } else {
                        classFiles.add(file);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                warnings.add(warn(file, "Cannot access: " + exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }
        });
        return classFiles;
    }

    private FileScan scanFile(Path file) {
        log.debug("Analyzing class file: {}", file);
        List<ScanWarning> warnings = new ArrayList<>();
        try {
            byte[] bytes = Files.readAllBytes(file);
            ClassFile classFile = ClassFileParser.parse(bytes);
            InvocationScanner.ClassScan classScan = invocationScanner.scan(classFile);
            for (String message : classScan.methodWarnings()) {
                warnings.add(warn(file, message));
            }
            return new FileScan(classScan.calls(), warnings);
        } catch (ClassFileFormatException e) {
            warnings.add(warn(file, "Failed to parse class file: " + e.getMessage()));
        } catch (IOException e) {
            warnings.add(warn(file, "Failed to read class file: " + e.getMessage()));
        } catch (ResolutionException e) {
            warnings.add(warn(file, "Cannot resolve class name: " + e.getMessage()));
        } catch (RuntimeException e) {
            warnings.add(warn(file, "Unexpected failure: " + e));
        }
        return new FileScan(List.of(), warnings);
    }

    private static ScanWarning warn(Path file, String message) {
        log.warn("Error analyzing {}: {}", file, message);
        return new ScanWarning(file, message);
    }

    /**
     * Converts a file path to a class name.
     * E.g., "com/company/MyClass.class" -> "com.company.MyClass"
     */
    static String pathToClassName(String path) {
        String withoutExtension = path.endsWith(".class") ? path.substring(0, path.length() - 6) : path;
        return withoutExtension.replace('/', '.').replace('\\', '.');
    }

    private boolean isExcluded(String className) {
        for (Pattern pattern : excludePatterns) {
            if (pattern.matcher(className).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob to regex: {@code **} matches any sequence, {@code *} any sequence without a dot,
     * everything else literally.
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                } else {
                    regex.append("[^.]*");
                    i++;
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.toString());
    }

    private record FileScan(List<FoundCall> calls, List<ScanWarning> warnings) {
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "jmf-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
