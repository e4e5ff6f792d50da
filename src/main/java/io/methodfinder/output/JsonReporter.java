package io.methodfinder.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.methodfinder.model.FoundCall;
import io.methodfinder.model.ScanResult;
import io.methodfinder.model.TargetMethod;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Formats scan results as JSON for machine processing.
 * <pre>
 * {
 *   "target" : "java.lang.String#toString",
 *   "calls" : [ { "class_name" : "...", "method_name" : "...", "line_number" : 8 } ]
 * }
 * </pre>
 * {@code line_number} is null when unknown.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.mapper = createMapper(prettyPrint);
    }

    private static ObjectMapper createMapper(boolean prettyPrint) {
        ObjectMapper m = new ObjectMapper();
        m.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.json;
    }

    @Override
    public void write(TargetMethod target, ScanResult result, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(target, result));
        writer.write(System.lineSeparator());
        writer.flush();
    }

    private JsonReport toJsonReport(TargetMethod target, ScanResult result) {
        return new JsonReport(
                target.key(),
                result.calls().stream()
                        .map(JsonReporter::toJsonCall)
                        .toList()
        );
    }

    private static JsonReport.Call toJsonCall(FoundCall call) {
        return new JsonReport.Call(call.className(), call.methodName(), call.lineNumber());
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            @JsonProperty("target") String target,
            @JsonProperty("calls") List<Call> calls
    ) {
        public record Call(
                @JsonProperty("class_name") String className,
                @JsonProperty("method_name") String methodName,
                @JsonProperty("line_number") Integer lineNumber
        ) {}
    }
}
