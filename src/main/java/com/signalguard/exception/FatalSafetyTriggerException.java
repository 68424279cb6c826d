package com.signalguard.exception;

import com.signalguard.domain.enums.SafetyTrigger;
import java.util.Map;
import lombok.Getter;

@Getter
public class FatalSafetyTriggerException extends BaseException {

    private final SafetyTrigger trigger;

    public FatalSafetyTriggerException(SafetyTrigger trigger, String message, Map<String, Object> details) {
        super(ErrorCode.FATAL_SAFETY_TRIGGER, message, details);
        this.trigger = trigger;
    }
}
