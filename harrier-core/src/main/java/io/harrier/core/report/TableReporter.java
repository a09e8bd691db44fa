package io.harrier.core.report;

import io.harrier.api.event.RunFinished;
import io.harrier.api.event.RunStarted;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.report.Reporter;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Buffers finished units and prints them as one table when the run ends.
 * Rows are ordered by project (configuration order), then module, then test.
 */
public class TableReporter implements Reporter {

    private static final String[] HEADERS = {"Project", "Module", "Test", "Result", "Time"};

    private final PrintStream out;
    private final List<UnitFinished> rows = new ArrayList<>();
    private List<String> projectOrder = List.of();

    public TableReporter() {
        this(System.out);
    }

    public TableReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onRunStarted(RunStarted event) {
        projectOrder = event.projects();
        rows.clear();
    }

    @Override
    public void onEnd(UnitFinished event) {
        rows.add(event);
    }

    @Override
    public void onRunFinished(RunFinished event) {
        out.print(render());
        out.println(ListReporter.summaryLine(event.summary()));
    }

    String render() {
        List<String[]> cells = new ArrayList<>();
        rows.stream()
                .sorted(Comparator
                        .comparingInt((UnitFinished u) -> projectRank(u.project()))
                        .thenComparing(u -> u.test().module())
                        .thenComparing(u -> u.test().displayName()))
                .forEach(u -> cells.add(new String[]{
                        u.project(),
                        u.test().module(),
                        u.test().displayName(),
                        u.outcome().kind().name(),
                        u.outcome().duration().toMillis() + "ms"
                }));

        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
        }
        for (String[] row : cells) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, HEADERS, widths);
        for (int i = 0; i < widths.length; i++) {
            sb.append(i == 0 ? "" : "-+-").append("-".repeat(widths[i]));
        }
        sb.append(System.lineSeparator());
        for (String[] row : cells) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    private int projectRank(String project) {
        int rank = projectOrder.indexOf(project);
        return rank < 0 ? Integer.MAX_VALUE : rank;
    }

    private static void appendRow(StringBuilder sb, String[] row, int[] widths) {
        for (int i = 0; i < row.length; i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            sb.append(String.format("%-" + widths[i] + "s", row[i]));
        }
        sb.append(System.lineSeparator());
    }

    @Override
    public String name() {
        return "table";
    }
}
