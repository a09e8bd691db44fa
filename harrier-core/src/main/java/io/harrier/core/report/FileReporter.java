package io.harrier.core.report;

import io.harrier.api.event.RunFinished;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.report.ReportGenerator;
import io.harrier.api.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects finished units and writes the JSON and CSV reports when the run ends.
 * <p>
 * For a base path {@code out/results} the files are {@code out/results.json}
 * and {@code out/results.csv}.
 */
public class FileReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(FileReporter.class);

    private final String basePath;
    private final List<ReportGenerator> generators;
    private final List<UnitFinished> finished = new ArrayList<>();
    private final List<Path> written = new ArrayList<>();

    public FileReporter(String basePath) {
        this(basePath, List.of(new JsonReportGenerator(), new CsvReportGenerator()));
    }

    public FileReporter(String basePath, List<ReportGenerator> generators) {
        this.basePath = basePath.replaceFirst("\\.(json|csv)$", "");
        this.generators = List.copyOf(generators);
    }

    @Override
    public void onEnd(UnitFinished event) {
        finished.add(event);
    }

    @Override
    public void onRunFinished(RunFinished event) {
        log.info("Generating run reports...");
        for (ReportGenerator generator : generators) {
            Path target = Path.of(basePath + "." + generator.format().toLowerCase());
            try {
                written.add(generator.generate(event.summary(), List.copyOf(finished), target));
            } catch (RuntimeException e) {
                log.error("Failed to generate {} report", generator.format(), e);
            }
        }
    }

    /**
     * @return report files written so far
     */
    public List<Path> written() {
        return List.copyOf(written);
    }

    @Override
    public String name() {
        return "file-report";
    }
}
