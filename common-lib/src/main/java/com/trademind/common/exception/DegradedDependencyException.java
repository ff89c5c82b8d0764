package com.trademind.common.exception;

/**
 * A dependency (memory store, embedding backend) is running degraded and refused the
 * call. Callers are expected to fall back or park the work, not to abort.
 */
public class DegradedDependencyException extends RuntimeException {
    private final String dependency;

    public DegradedDependencyException(String dependency, String message) {
        super(dependency + ": " + message);
        this.dependency = dependency;
    }

    public DegradedDependencyException(String dependency, String message, Throwable cause) {
        super(dependency + ": " + message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
