package com.ivamare.kernelbus.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an event subscriber.
 *
 * <p>Methods annotated with @Subscribe on Spring beans are discovered by
 * {@link SubscriberRegistrar} and registered with the dispatcher.
 *
 * <p>Subscriber methods must have the signature:
 * <pre>
 * void onXxx(Event&lt;?&gt; event)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class LoginAlerts {
 *
 *     {@literal @}Subscribe(event = "audit:logged")
 *     public void onAudited(Event&lt;?&gt; event) {
 *         var entry = (AuditEntry) event.payload();
 *         // react to the appended entry...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Subscribe {

    /**
     * The event name to subscribe to.
     *
     * @return event name (e.g., "audit:logged")
     */
    String event();

    /**
     * Whether the subscription is removed after its first delivery.
     *
     * @return true for a once-subscription
     */
    boolean once() default false;
}
