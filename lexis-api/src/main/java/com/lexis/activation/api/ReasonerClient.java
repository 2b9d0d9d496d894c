package com.lexis.activation.api;

import com.lexis.activation.api.exceptions.ReasonerException;
import com.lexis.activation.api.model.ReasonerRequest;
import com.lexis.activation.api.model.ReasonerResponse;

/**
 * Network client of the external reasoning service.
 *
 * <p>Called at most once per dispatch and from a dispatcher-owned thread. Implementations
 * may block; the dispatcher enforces the timeout.
 */
@FunctionalInterface
public interface ReasonerClient {

    /**
     * Judges every module of the request.
     *
     * @throws ReasonerException on transport failures or unreadable answers
     */
    ReasonerResponse reason(ReasonerRequest request) throws ReasonerException;
}
