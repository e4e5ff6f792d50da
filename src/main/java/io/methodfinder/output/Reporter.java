package io.methodfinder.output;

import io.methodfinder.model.ScanResult;
import io.methodfinder.model.TargetMethod;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for report output formatters.
 */
public interface Reporter {

    /**
     * Returns the format this reporter writes.
     */
    OutputFormat format();

    /**
     * Writes the report to the given writer.
     */
    void write(TargetMethod target, ScanResult result, Writer writer) throws IOException;

    /**
     * Writes the report to the given file path.
     */
    default void write(TargetMethod target, ScanResult result, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(target, result, writer);
        }
    }

    /**
     * Returns the report as a string.
     */
    default String toString(TargetMethod target, ScanResult result) {
        try {
            StringWriter writer = new StringWriter();
            write(target, result, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }

    static Reporter forFormat(OutputFormat format) {
        return switch (format) {
            case txt -> new TextReporter();
            case json -> new JsonReporter();
        };
    }
}
