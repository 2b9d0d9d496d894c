package com.lexis.activation.api.exceptions;

/**
 * A rule tree nests deeper than the configured limit. Rejects the module, never the request.
 */
public class RuleDepthExceededException extends MisconfiguredModuleException {

    private final int maxDepth;

    public RuleDepthExceededException(int maxDepth) {
        this(null, maxDepth);
    }

    public RuleDepthExceededException(String moduleId, int maxDepth) {
        super(moduleId, "Rule tree exceeds maximum depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
