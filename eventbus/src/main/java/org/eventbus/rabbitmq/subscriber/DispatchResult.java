package org.eventbus.rabbitmq.subscriber;

/**
 * Outcome of dispatching one message.
 *
 * @param failure cause of a {@link Status#FAILED} dispatch, otherwise {@code null}
 */
public record DispatchResult(Status status, Throwable failure) {

    public enum Status {
        /** Handled or stored, then acknowledged. */
        ACKNOWLEDGED,
        /** No subscription for the event type; left unacknowledged. */
        NO_SUBSCRIBERS,
        /** Processing failed; left unacknowledged. */
        FAILED
    }

    static final DispatchResult ACKNOWLEDGED = new DispatchResult(Status.ACKNOWLEDGED, null);
    static final DispatchResult NO_SUBSCRIBERS = new DispatchResult(Status.NO_SUBSCRIBERS, null);

    static DispatchResult failed(Throwable failure) {
        return new DispatchResult(Status.FAILED, failure);
    }

    public boolean isAcknowledged() { return status == Status.ACKNOWLEDGED; }
}
