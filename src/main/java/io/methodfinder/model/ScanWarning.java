package io.methodfinder.model;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * A problem that excluded one file, or one method of a file, from the results.
 *
 * @param file    the class file concerned
 * @param message what went wrong
 */
public record ScanWarning(Path file, String message) {

    public static final Comparator<ScanWarning> ORDER = Comparator
        .comparing((ScanWarning w) -> w.file().toString())
        .thenComparing(ScanWarning::message);

    @Override
    public String toString() {
        return file + ": " + message;
    }
}
