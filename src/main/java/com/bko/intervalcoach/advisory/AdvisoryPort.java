package com.bko.intervalcoach.advisory;

/**
 * Provider-agnostic access to the external advisory oracle.
 */
public interface AdvisoryPort {
    boolean isAvailable();

    AdvisoryReply ask(AdvisoryPrompt prompt);

    record AdvisoryPrompt(String purpose, String text) {}

    record AdvisoryReply(String model, String text) {}
}
