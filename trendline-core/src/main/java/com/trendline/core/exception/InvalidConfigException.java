package com.trendline.core.exception;

import java.util.List;

/**
 * Strategy configuration constraint violation. Carries every violated constraint.
 */
public class InvalidConfigException extends TrendlineException {

    private final List<String> violations;

    public InvalidConfigException(List<String> violations) {
        super("Invalid strategy config: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
