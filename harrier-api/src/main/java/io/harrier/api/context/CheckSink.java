package io.harrier.api.context;

import io.harrier.api.check.CheckResult;

/**
 * Receives check results of the test currently executing.
 */
@FunctionalInterface
public interface CheckSink {

    void record(CheckResult result);
}
