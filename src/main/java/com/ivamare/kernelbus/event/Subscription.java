package com.ivamare.kernelbus.event;

/**
 * Deregistration handle returned by the dispatcher.
 *
 * <p>Holders never see the registry itself; {@link #unsubscribe()} removes exactly
 * the registration that produced this handle and is idempotent.
 */
public interface Subscription {

    /**
     * @return name of the event this subscription listens to
     */
    String eventName();

    /**
     * Remove this registration. Calling it again is a no-op.
     */
    void unsubscribe();

    /**
     * @return false once unsubscribed, cleared, or fired (for once-subscriptions)
     */
    boolean isActive();
}
