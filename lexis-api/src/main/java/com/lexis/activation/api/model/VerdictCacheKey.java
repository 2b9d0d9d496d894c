package com.lexis.activation.api.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Cache identity of reasoner verdicts: the document type plus a SHA-256 digest of the
 * slug-sorted variables sent to the reasoner.
 */
public record VerdictCacheKey(String documentType, String snapshotHash) implements Serializable {

    public VerdictCacheKey {
        Objects.requireNonNull(documentType, "documentType cannot be null");
        Objects.requireNonNull(snapshotHash, "snapshotHash cannot be null");
    }

    @Override
    public String toString() {
        return documentType + ":" + snapshotHash;
    }
}
