package io.methodfinder.output;

import io.methodfinder.model.FoundCall;
import io.methodfinder.model.ScanResult;
import io.methodfinder.model.TargetMethod;

import java.io.IOException;
import java.io.Writer;

/**
 * Plain text report:
 * <pre>
 * java.lang.String#toString
 *  - com.example.TestClass#testMethod (L8)
 *  - com.example.TestClass#helper
 * </pre>
 * The line suffix is left out when the line is unknown. An empty result prints "No results".
 */
public class TextReporter implements Reporter {

    static final String NO_RESULTS = "No results";

    @Override
    public OutputFormat format() {
        return OutputFormat.txt;
    }

    @Override
    public void write(TargetMethod target, ScanResult result, Writer writer) throws IOException {
        writer.write(target.key());
        writer.write(System.lineSeparator());
        if (!result.hasCalls()) {
            writer.write(NO_RESULTS);
            writer.write(System.lineSeparator());
        }
        for (FoundCall call : result.calls()) {
            writer.write(" - ");
            writer.write(call.formatted());
            writer.write(System.lineSeparator());
        }
        writer.flush();
    }
}
