package com.signalguard.event;

import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.domain.model.SafetyTransition;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every safety-level transition, after the new snapshot is visible.
 */
public class SafetyStateChangedEvent extends ApplicationEvent {

    private final SafetyTransition transition;
    private final SafetySnapshot snapshot;

    public SafetyStateChangedEvent(Object source, SafetyTransition transition, SafetySnapshot snapshot) {
        super(source);
        this.transition = transition;
        this.snapshot = snapshot;
    }

    public SafetyTransition getTransition() {
        return transition;
    }

    public SafetySnapshot getSnapshot() {
        return snapshot;
    }
}
