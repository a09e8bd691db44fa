package io.harrier.core.report;

import io.harrier.api.check.CheckFailure;
import io.harrier.api.event.CheckEvaluated;
import io.harrier.api.event.RunFinished;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.event.UnitRetried;
import io.harrier.api.outcome.Outcome;
import io.harrier.api.outcome.RunSummary;
import io.harrier.api.report.Reporter;

import java.io.PrintStream;

/**
 * Prints one line per finished unit as results arrive, followed by failure details.
 */
public class ListReporter implements Reporter {

    private final PrintStream out;
    private final boolean showChecks;

    public ListReporter() {
        this(System.out, false);
    }

    /**
     * @param showChecks also print every passing check as it is evaluated
     */
    public ListReporter(PrintStream out, boolean showChecks) {
        this.out = out;
        this.showChecks = showChecks;
    }

    @Override
    public void onCheck(CheckEvaluated event) {
        if (showChecks && event.passed()) {
            out.printf("    ok [%s] %s: %s%n", event.project(), event.test().fullName(),
                    event.detail().expression());
        }
    }

    @Override
    public void onRetry(UnitRetried event) {
        out.printf("  RETRY [%s] %s (attempt %d failed with %s, next in %dms)%n",
                event.project(), event.test().fullName(), event.attempt(),
                event.previous().kind(), event.delay().toMillis());
    }

    @Override
    public void onEnd(UnitFinished event) {
        Outcome outcome = event.outcome();
        out.printf("%-8s [%s] %s (%dms)%n", outcome.kind(), event.project(), event.test().fullName(),
                outcome.duration().toMillis());

        if (outcome instanceof Outcome.Failed failed) {
            for (CheckFailure failure : failed.failures()) {
                out.println("    " + failure);
            }
        } else if (outcome instanceof Outcome.Errored errored) {
            out.println("    error: " + errored.cause());
        } else if (outcome instanceof Outcome.Panicked panicked) {
            out.println("    panic: " + panicked.message()
                    + (panicked.location() != null ? " at " + panicked.location() : ""));
        } else if (outcome instanceof Outcome.Skipped skipped) {
            out.println("    skipped: " + skipped.reason());
        }
    }

    @Override
    public void onRunFinished(RunFinished event) {
        out.println(summaryLine(event.summary()));
    }

    static String summaryLine(RunSummary summary) {
        return "%d passed, %d failed, %d errored, %d panicked, %d skipped, %d cancelled in %dms".formatted(
                summary.count(Outcome.Kind.PASSED),
                summary.count(Outcome.Kind.FAILED),
                summary.count(Outcome.Kind.ERRORED),
                summary.count(Outcome.Kind.PANICKED),
                summary.count(Outcome.Kind.SKIPPED),
                summary.cancelled(),
                summary.totalDuration().toMillis());
    }

    @Override
    public String name() {
        return "list";
    }
}
