package com.khaounen.security.sessionrisk;

// called once per session, outside the tracker's locks
@FunctionalInterface
public interface SessionBlockListener {

    SessionBlockListener NOOP = event -> { };

    void onBlock(SessionBlockEvent event);
}
