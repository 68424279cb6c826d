package com.signalguard.exception;

import com.signalguard.domain.enums.LifecycleState;
import java.util.Map;

public class IllegalLifecycleTransitionException extends BaseException {

    public IllegalLifecycleTransitionException(String positionId, LifecycleState from, LifecycleState to) {
        super(
                ErrorCode.ILLEGAL_STATE_TRANSITION,
                "Position " + positionId + " cannot move from " + from + " to " + to,
                Map.of("positionId", String.valueOf(positionId), "from", String.valueOf(from), "to", String.valueOf(to)));
    }
}
