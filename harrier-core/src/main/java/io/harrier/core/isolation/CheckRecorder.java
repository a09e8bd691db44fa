package io.harrier.core.isolation;

import io.harrier.api.check.CheckFailure;
import io.harrier.api.check.CheckResult;
import io.harrier.api.context.CheckSink;
import io.harrier.api.context.ContextClosedException;
import io.harrier.api.event.CheckEvaluated;
import io.harrier.api.test.RunUnit;
import io.harrier.core.bus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Check sink of one attempt: publishes every check and keeps the failures.
 * Wrapped sub-work may record from other threads until the attempt is sealed.
 */
class CheckRecorder implements CheckSink {

    private static final Logger log = LoggerFactory.getLogger(CheckRecorder.class);

    private final RunUnit unit;
    private final EventBus bus;
    private final Clock clock;
    private final List<CheckFailure> failures = new ArrayList<>();
    private boolean sealed = false;

    CheckRecorder(RunUnit unit, EventBus bus, Clock clock) {
        this.unit = unit;
        this.bus = bus;
        this.clock = clock;
    }

    @Override
    public void record(CheckResult result) {
        synchronized (this) {
            if (sealed) {
                log.warn("Check `{}` of {} arrived after the attempt finished; it is not part of the outcome",
                        result.expression(), unit.id());
                throw new ContextClosedException("Check `" + result.expression() + "` recorded after " + unit.id()
                        + " finished. Wait for sub-work started from the test body before it returns");
            }
            if (!result.passed()) {
                failures.add(result.toFailure());
            }
            bus.publish(new CheckEvaluated(unit.id(), unit.projectName(), unit.info(), result, clock.instant()));
        }
    }

    /**
     * Reject further checks and return the failures recorded so far.
     */
    synchronized List<CheckFailure> seal() {
        sealed = true;
        return List.copyOf(failures);
    }
}
