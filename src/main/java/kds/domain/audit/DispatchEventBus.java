package kds.domain.audit;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;

/**
 * Application event bus (Guava). Subscriber exceptions are logged, never rethrown to the poster.
 * @since 06/10/2026
 */
@Singleton
public class DispatchEventBus {
    private static final Logger logger = LoggerFactory.getLogger(DispatchEventBus.class);

    private final EventBus eventBus;

    public DispatchEventBus() {
        this.eventBus = new EventBus(DispatchEventBus::onSubscriberException);
    }

    public DispatchEventBus(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void register(Object subscriber) {
        eventBus.register(subscriber);
    }

    public void unregister(Object subscriber) {
        eventBus.unregister(subscriber);
    }

    public void post(Object event) {
        eventBus.post(event);
    }

    private static void onSubscriberException(Throwable exception, SubscriberExceptionContext context) {
        logger.warn("Event subscriber {} failed on {}: {}",
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(),
                exception.getMessage());
    }
}
