package com.signalguard.domain.enums;

/**
 * Response to an exchange position that has no local record.
 * NOTIFY_ONLY is the default; adoption is an explicit operator choice.
 */
public enum OrphanPolicy {
    NOTIFY_ONLY,
    ADOPT_AND_PROTECT
}
