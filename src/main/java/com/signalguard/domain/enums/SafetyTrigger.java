package com.signalguard.domain.enums;

/**
 * Source of a safety-state transition. Recorded on every transition.
 */
public enum SafetyTrigger {

    /** External kill switch (file, environment key or stored flag). */
    KILL_SWITCH,

    /** Equity fell from its peak by more than the configured drawdown. */
    DRAWDOWN,

    /** Protective stop could not be placed after bounded retries. */
    PROTECTION_FAILURE,

    /** Reconciliation repairs failed repeatedly. */
    RECONCILIATION,

    /** Too many failed exchange calls inside the error window. */
    API_ERROR_BURST,

    /** Used margin relative to equity above the configured ratio. */
    MARGIN_USAGE,

    /** Startup capability probe failed and the operator asked for safe mode on failure. */
    CAPABILITY_PROBE,

    /** Local-guard stop running on a degraded price feed. */
    FEED_DEGRADED,

    /** Manual operator action. */
    OPERATOR
}
