package com.lexis.activation.api.exceptions;

/**
 * A module definition cannot be evaluated as configured.
 */
public class MisconfiguredModuleException extends ActivationException {

    private final String moduleId;

    public MisconfiguredModuleException(String moduleId, String message) {
        super(message);
        this.moduleId = moduleId;
    }

    public MisconfiguredModuleException(String moduleId, String message, Throwable cause) {
        super(message, cause);
        this.moduleId = moduleId;
    }

    public String getModuleId() {
        return moduleId;
    }
}
