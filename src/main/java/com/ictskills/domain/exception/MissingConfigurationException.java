package com.ictskills.domain.exception;

public class MissingConfigurationException extends SkillsAnalyticsException {
    private final String property;

    public MissingConfigurationException(String property) {
        super("Required configuration is not set: " + property);
        this.property = property;
    }

    public MissingConfigurationException(String property, Throwable cause) {
        super("Required configuration is not set: " + property, cause);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
