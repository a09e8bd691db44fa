package io.harrier.api.report;

import io.harrier.api.event.UnitFinished;
import io.harrier.api.outcome.RunSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes a report file from the finished units of a completed run.
 * Implementations can produce JSON, CSV, or any other format.
 */
public interface ReportGenerator {

    /**
     * Generate a report file.
     *
     * @param summary    the run summary
     * @param units      finished units in completion order
     * @param outputPath path where the report file should be written
     * @return the path to the generated report
     */
    Path generate(RunSummary summary, List<UnitFinished> units, Path outputPath);

    /**
     * @return the format name (e.g., "JSON", "CSV")
     */
    String format();
}
