package com.ictskills.domain.exception;

/**
 * Base type for every failure raised by the skills pipeline.
 */
public class SkillsAnalyticsException extends RuntimeException {

    public SkillsAnalyticsException(String message) {
        super(message);
    }

    public SkillsAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
