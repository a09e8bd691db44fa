package io.harrier.core.report;

import io.harrier.api.report.Reporter;

/**
 * Discards every event.
 */
public class NullReporter implements Reporter {
}
