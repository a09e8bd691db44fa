package io.harrier.core.report;

import io.harrier.api.event.UnitFinished;
import io.harrier.api.outcome.RunSummary;
import io.harrier.api.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one CSV row per finished unit, for spreadsheets and dashboards.
 */
public class CsvReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(CsvReportGenerator.class);

    static final String HEADER = "project,module,test,outcome,started_at,duration_ms,detail";

    @Override
    public Path generate(RunSummary summary, List<UnitFinished> units, Path outputPath) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);

        for (UnitFinished unit : units) {
            UnitRecord record = UnitRecord.of(unit);
            lines.add("%s,%s,%s,%s,%s,%d,%s".formatted(
                    escapeCsv(record.project()),
                    escapeCsv(record.module()),
                    escapeCsv(record.test()),
                    record.outcome(),
                    record.startedAt(),
                    record.durationMs(),
                    escapeCsv(record.detail() != null ? record.detail() : "")
            ));
        }

        try {
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            Files.write(outputPath, lines);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV report to " + outputPath, e);
        }
        log.info("CSV report generated: {}", outputPath);
        return outputPath;
    }

    @Override
    public String format() {
        return "CSV";
    }

    static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
