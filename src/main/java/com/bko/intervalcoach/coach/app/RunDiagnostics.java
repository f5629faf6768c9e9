package com.bko.intervalcoach.coach.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Messages collected during one coaching run. A degraded run still produces a recommendation.
 */
public class RunDiagnostics {
    private final List<String> messages = new ArrayList<>();
    private boolean degraded;

    public void info(String message) {
        messages.add(message);
    }

    public void warn(String message) {
        messages.add("WARN: " + message);
        degraded = true;
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isDegraded() {
        return degraded;
    }
}
