package com.khaounen.security.sessionrisk;

public enum SessionState {
    ACTIVE,
    BLOCKED
}
