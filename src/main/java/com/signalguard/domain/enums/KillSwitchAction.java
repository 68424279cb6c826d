package com.signalguard.domain.enums;

public enum KillSwitchAction {
    NONE,
    SAFE_MODE,
    PANIC_CLOSE
}
