package com.ictskills.domain.exception;

/**
 * Raw survey input is unreadable, absent or structurally broken.
 * Fatal to an ETL run; nothing is written.
 */
public class DataSourceException extends SkillsAnalyticsException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
