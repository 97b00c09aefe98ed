package com.phillippitts.affectsignal.testutil;

import com.phillippitts.affectsignal.service.pipeline.event.ExpressionRecordedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public List<ExpressionRecordedEvent> recordedEvents() {
        return events.stream()
                .filter(e -> e instanceof ExpressionRecordedEvent)
                .map(e -> (ExpressionRecordedEvent) e)
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
