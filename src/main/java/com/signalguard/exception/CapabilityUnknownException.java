package com.signalguard.exception;

import com.signalguard.domain.enums.CapabilityKind;
import java.util.Map;

/**
 * Inconclusive capability probe. Converted to an UNKNOWN capability record by the
 * capability cache, never to UNSUPPORTED.
 */
public class CapabilityUnknownException extends BaseException {

    public CapabilityUnknownException(CapabilityKind kind, String message, Throwable cause) {
        super(ErrorCode.CAPABILITY_UNKNOWN, message, Map.of("capability", kind.name()), cause);
    }
}
