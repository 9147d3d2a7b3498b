package com.ivamare.kernelbus.handler;

import com.ivamare.kernelbus.api.EventDispatcher;
import com.ivamare.kernelbus.event.Event;
import com.ivamare.kernelbus.event.EventType;
import com.ivamare.kernelbus.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Discovers {@link Subscribe} methods on Spring beans and registers them with the dispatcher.
 *
 * <p>The dispatcher is resolved lazily so that this post-processor can be
 * registered before the dispatcher bean exists.
 */
public class SubscriberRegistrar implements BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(SubscriberRegistrar.class);

    private final Supplier<EventDispatcher> dispatcher;

    public SubscriberRegistrar(ObjectProvider<EventDispatcher> dispatcher) {
        this.dispatcher = dispatcher::getObject;
    }

    public SubscriberRegistrar(EventDispatcher dispatcher) {
        this.dispatcher = () -> dispatcher;
    }

    /**
     * Register every {@link Subscribe} method of a bean.
     *
     * @param bean The bean to scan
     * @return subscriptions created, in method discovery order
     */
    public List<Subscription> registerBean(Object bean) {
        List<Subscription> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            Subscribe annotation = method.getAnnotation(Subscribe.class);
            if (annotation == null) {
                continue;
            }

            validateSubscriberMethod(method);

            EventType<Object> type = EventType.named(annotation.event());
            EventHandler<Object> handler = event -> invoke(bean, method, event);

            Subscription subscription = annotation.once()
                ? dispatcher.get().subscribeOnce(type, handler)
                : dispatcher.get().subscribe(type, handler);
            registered.add(subscription);

            log.info("Discovered subscriber {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), annotation.event());
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @Subscribe methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasSubscribers = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(Subscribe.class));

        if (hasSubscribers) {
            registerBean(bean);
        }

        return bean;
    }

    private static void invoke(Object bean, Method method, Event<Object> event) throws Exception {
        try {
            method.invoke(bean, event);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private void validateSubscriberMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1 || !params[0].equals(Event.class)) {
            throw new IllegalArgumentException(
                "Subscriber method " + method.getName() + " must have signature: " +
                "void methodName(Event<?> event)"
            );
        }
    }
}
