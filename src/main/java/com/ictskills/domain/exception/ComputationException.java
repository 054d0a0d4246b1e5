package com.ictskills.domain.exception;

/**
 * Unexpected failure while computing dashboard aggregates.
 * Never escapes the dashboard boundary; it is reported as an error result.
 */
public class ComputationException extends SkillsAnalyticsException {

    public ComputationException(String message) {
        super(message);
    }
}
