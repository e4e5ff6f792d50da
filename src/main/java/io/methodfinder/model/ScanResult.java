package io.methodfinder.model;

import java.util.List;

/**
 * Container for the complete scan result.
 *
 * @param calls         every call site found, sorted by {@link FoundCall#ORDER}
 * @param warnings      per-file and per-method problems, sorted by {@link ScanWarning#ORDER}
 * @param filesScanned  number of class files dispatched for parsing
 */
public record ScanResult(
    List<FoundCall> calls,
    List<ScanWarning> warnings,
    int filesScanned
) {
    /**
     * Create a ScanResult with sorted, immutable copies of the lists.
     */
    public ScanResult {
        calls = calls.stream().sorted(FoundCall.ORDER).toList();
        warnings = warnings.stream().sorted(ScanWarning.ORDER).toList();
    }

    public boolean hasCalls() {
        return !calls.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
