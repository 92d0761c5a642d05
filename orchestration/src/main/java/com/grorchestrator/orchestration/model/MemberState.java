package com.grorchestrator.orchestration.model;

/**
 * Member state as reported by the engine.
 */
public enum MemberState {
    ONLINE,
    RECOVERING,
    OFFLINE,
    ERROR,
    UNREACHABLE,
    MISSING;

    public static MemberState fromEngineValue(String value) {
        if (value == null) {
            return MISSING;
        }
        for (MemberState state : values()) {
            if (state.name().equalsIgnoreCase(value.trim())) {
                return state;
            }
        }
        // '(MISSING)' and other decorated values
        return value.toUpperCase().contains("MISSING") ? MISSING : ERROR;
    }

    public boolean isReachable() {
        return this == ONLINE || this == RECOVERING;
    }
}
