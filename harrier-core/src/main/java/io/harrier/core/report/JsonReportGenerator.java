package io.harrier.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.outcome.Outcome;
import io.harrier.api.outcome.RunSummary;
import io.harrier.api.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the summary and every finished unit of a run to a JSON file.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path generate(RunSummary summary, List<UnitFinished> units, Path outputPath) {
        try {
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            objectMapper.writeValue(outputPath.toFile(), toReport(summary, units));
            log.info("Run report written to: {}", outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON report to " + outputPath, e);
        }
    }

    @Override
    public String format() {
        return "JSON";
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    static Report toReport(RunSummary summary, List<UnitFinished> units) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Outcome.Kind kind : Outcome.Kind.values()) {
            counts.put(kind.name(), summary.count(kind));
        }
        return new Report(
                summary.startTime(),
                summary.endTime(),
                summary.totalDuration().toMillis(),
                counts,
                summary.cancelled(),
                summary.exitCode(),
                units.stream().map(UnitRecord::of).toList()
        );
    }

    /**
     * Root of the JSON document.
     */
    public record Report(
            Instant startTime,
            Instant endTime,
            long durationMs,
            Map<String, Integer> counts,
            int cancelled,
            int exitCode,
            List<UnitRecord> units
    ) {}
}
