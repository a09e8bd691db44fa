package io.harrier.api.event;

/**
 * Consumer of run events. Each subscriber is fed from its own thread, so
 * implementations need no synchronization of their own state.
 */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(RunEvent event);

    /**
     * @return name used in logs
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
