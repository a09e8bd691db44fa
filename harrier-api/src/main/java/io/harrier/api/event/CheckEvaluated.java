package io.harrier.api.event;

import io.harrier.api.check.CheckResult;
import io.harrier.api.test.TestInfo;

import java.time.Instant;

public record CheckEvaluated(String unitId, String project, TestInfo test, CheckResult detail, Instant timestamp)
        implements UnitEvent {

    public boolean passed() {
        return detail.passed();
    }
}
