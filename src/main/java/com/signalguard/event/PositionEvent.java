package com.signalguard.event;

import com.signalguard.domain.model.ManagedPosition;
import org.springframework.context.ApplicationEvent;

public class PositionEvent extends ApplicationEvent {

    private final ManagedPosition position;
    private final PositionEventType eventType;
    private final String message;

    public PositionEvent(Object source, ManagedPosition position, PositionEventType eventType, String message) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.message = message;
    }

    public ManagedPosition getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }
}
