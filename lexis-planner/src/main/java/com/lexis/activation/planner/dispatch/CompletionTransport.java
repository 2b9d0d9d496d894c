package com.lexis.activation.planner.dispatch;

import java.io.IOException;

/**
 * Raw text completion endpoint of a language model.
 */
@FunctionalInterface
public interface CompletionTransport {

    String complete(String prompt) throws IOException;
}
