package io.harrier.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import io.harrier.api.check.CheckFailure;
import io.harrier.api.event.RunFinished;
import io.harrier.api.event.RunStarted;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.outcome.Outcome;
import io.harrier.api.outcome.RunSummary;
import io.harrier.api.test.TestInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportGeneratorTest {

    private static final Instant START = Instant.parse("2026-02-14T10:00:00Z");

    @TempDir
    Path tempDir;

    private static UnitFinished finished(String project, String module, String test, Outcome outcome) {
        var info = new TestInfo(module, test, 0, test);
        return new UnitFinished(info.uniqueName(project), project, info, outcome, outcome.finishedAt());
    }

    private List<UnitFinished> units() {
        return List.of(
                finished("staging", "users", "create_user", new Outcome.Passed(START, START.plusMillis(42))),
                finished("staging", "users", "delete_user", new Outcome.Failed(
                        List.of(new CheckFailure("left == right", "204", "500", "status, unexpected")),
                        START, START.plusMillis(80))),
                finished("prod", "health", "ping", new Outcome.Errored("connection refused", START, START.plusMillis(5))),
                finished("prod", "auth", "login", new Outcome.Panicked("login failed with message: boom",
                        "Login.java:12", START, START.plusMillis(7))));
    }

    private RunSummary summary() {
        return new RunSummary(START, START.plusSeconds(2), Duration.ofSeconds(2), Map.of(
                Outcome.Kind.PASSED, 1,
                Outcome.Kind.FAILED, 1,
                Outcome.Kind.ERRORED, 1,
                Outcome.Kind.PANICKED, 1), 2, true);
    }

    // ─── JSON Report ───

    @Test
    void shouldGenerateJsonReport() throws IOException {
        var generator = new JsonReportGenerator();
        Path output = generator.generate(summary(), units(), tempDir.resolve("out/report.json"));

        assertThat(output).exists();
        JsonNode root = generator.objectMapper().readTree(output.toFile());

        assertThat(root.get("startTime").asText()).isEqualTo("2026-02-14T10:00:00Z");
        assertThat(root.get("durationMs").asLong()).isEqualTo(2000);
        assertThat(root.get("counts").get("FAILED").asInt()).isEqualTo(1);
        assertThat(root.get("cancelled").asInt()).isEqualTo(2);
        assertThat(root.get("exitCode").asInt()).isEqualTo(1);
        assertThat(root.get("units").size()).isEqualTo(4);

        JsonNode failed = root.get("units").get(1);
        assertThat(failed.get("outcome").asText()).isEqualTo("FAILED");
        assertThat(failed.get("failures").get(0).get("right").asText()).isEqualTo("500");

        JsonNode panicked = root.get("units").get(3);
        assertThat(panicked.get("location").asText()).isEqualTo("Login.java:12");
    }

    // ─── CSV Report ───

    @Test
    void shouldGenerateCsvReport() throws IOException {
        Path output = new CsvReportGenerator().generate(summary(), units(), tempDir.resolve("report.csv"));

        List<String> lines = Files.readAllLines(output);
        assertThat(lines).hasSize(5);
        assertThat(lines.get(0)).isEqualTo(CsvReportGenerator.HEADER);
        assertThat(lines.get(1)).startsWith("staging,users,create_user,PASSED,2026-02-14T10:00:00Z,42,");
        assertThat(lines.get(3)).isEqualTo("prod,health,ping,ERRORED,2026-02-14T10:00:00Z,5,connection refused");
    }

    @Test
    void csvShouldEscapeSpecialCharacters() {
        assertThat(CsvReportGenerator.escapeCsv("plain")).isEqualTo("plain");
        assertThat(CsvReportGenerator.escapeCsv("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvReportGenerator.escapeCsv("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
    }

    // ─── File reporter ───

    @Test
    void fileReporterShouldWriteBothFormatsAtRunEnd() {
        var reporter = new FileReporter(tempDir.resolve("results.json").toString());

        units().forEach(reporter::onEvent);
        reporter.onEvent(new RunFinished(summary(), START.plusSeconds(2)));

        assertThat(reporter.written()).containsExactly(
                tempDir.resolve("results.json"),
                tempDir.resolve("results.csv"));
        assertThat(tempDir.resolve("results.csv")).exists();
    }

    // ─── Console reporters ───

    @Test
    void tableShouldFollowProjectOrderThenModuleThenTest() {
        var out = new ByteArrayOutputStream();
        var reporter = new TableReporter(new PrintStream(out, true, StandardCharsets.UTF_8));

        reporter.onEvent(new RunStarted(List.of("staging", "prod"), 4, 4, START));
        units().forEach(reporter::onEvent);
        String table = reporter.render();

        List<String> rows = table.lines().skip(2).toList();
        assertThat(rows).hasSize(4);
        assertThat(rows.get(0)).startsWith("staging").contains("create_user");
        assertThat(rows.get(1)).startsWith("staging").contains("delete_user");
        assertThat(rows.get(2)).startsWith("prod").contains("auth").contains("PANICKED");
        assertThat(rows.get(3)).startsWith("prod").contains("health");

        reporter.onEvent(new RunFinished(summary(), START.plusSeconds(2)));
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Project")
                .contains("1 passed, 1 failed, 1 errored, 1 panicked, 0 skipped, 2 cancelled in 2000ms");
    }

    @Test
    void listReporterShouldPrintFailureDetails() {
        var out = new ByteArrayOutputStream();
        var reporter = new ListReporter(new PrintStream(out, true, StandardCharsets.UTF_8), false);

        units().forEach(reporter::onEvent);
        String printed = out.toString(StandardCharsets.UTF_8);

        assertThat(printed)
                .contains("PASSED   [staging] users::create_user (42ms)")
                .contains("check failed: `left == right`: status, unexpected")
                .contains("error: connection refused")
                .contains("panic: login failed with message: boom at Login.java:12");
    }

    @Test
    void nullReporterShouldIgnoreEverything() {
        var reporter = new NullReporter();

        units().forEach(reporter::onEvent);
        reporter.onEvent(new RunFinished(summary(), START));

        assertThat(reporter.name()).isEqualTo("NullReporter");
    }
}
