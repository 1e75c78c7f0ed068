package com.sheetengine.app.events;

import org.springframework.context.ApplicationEventPublisher;

/**
 * EventBus backed by the application context; listeners subscribe with
 * {@code @EventListener(SheetChangedEvent.class)}.
 */
public class SpringEventBus implements EventBus {

    private final ApplicationEventPublisher publisher;

    public SpringEventBus(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(String documentId, String sheetId, String addressOrRange, Object newValue) {
        publisher.publishEvent(new SheetChangedEvent(this, documentId, sheetId, addressOrRange, newValue));
    }
}
