package com.khaounen.security.sessionrisk;

import java.util.ArrayList;
import java.util.List;

public final class RiskEventWindow {

    private final RiskEvent[] events;
    private int head;
    private int size;

    public RiskEventWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("window capacity must be positive: " + capacity);
        }
        this.events = new RiskEvent[capacity];
    }

    public void add(RiskEvent event) {
        events[head] = event;
        head = (head + 1) % events.length;
        if (size < events.length) {
            size++;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return events.length;
    }

    // oldest first
    public List<RiskEvent> recent(int count) {
        int n = Math.min(Math.max(0, count), size);
        List<RiskEvent> result = new ArrayList<>(n);
        int start = head - n;
        for (int i = 0; i < n; i++) {
            result.add(events[Math.floorMod(start + i, events.length)]);
        }
        return result;
    }

    public List<RiskEvent> snapshot() {
        return recent(size);
    }
}
