package io.harrier.api.event;

import io.harrier.api.test.TestInfo;

/**
 * Event about one run unit.
 */
public interface UnitEvent extends RunEvent {

    String unitId();

    String project();

    TestInfo test();
}
