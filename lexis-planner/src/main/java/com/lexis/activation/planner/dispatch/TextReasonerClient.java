package com.lexis.activation.planner.dispatch;

import com.lexis.activation.api.ReasonerClient;
import com.lexis.activation.api.exceptions.ReasonerException;
import com.lexis.activation.api.model.ReasonerRequest;
import com.lexis.activation.api.model.ReasonerResponse;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ReasonerClient} over a plain text completion endpoint: renders the request into
 * a prompt and decodes the model's answer.
 */
public final class TextReasonerClient implements ReasonerClient {

    static final String DEFAULT_INSTRUCTIONS = """
            You decide which optional modules belong in a legal document.
            Each module has an activation condition describing the facts that call for it.
            Activate a module only when the variables clearly satisfy its condition.
            A variable marked "not_applicable" does not apply to this case.
            Answer only with JSON in this format, one entry per module:
            {"verdicts": [{"id": "<module id>", "activate": true, "reason": "<short reason>"}], "confidence": "high|medium|low"}
            """;

    private final CompletionTransport transport;
    private final ReasonerPayloadCodec codec;
    private final String instructions;

    public TextReasonerClient(CompletionTransport transport) {
        this(transport, new ReasonerPayloadCodec(), DEFAULT_INSTRUCTIONS);
    }

    public TextReasonerClient(CompletionTransport transport, ReasonerPayloadCodec codec, String instructions) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.instructions = Objects.requireNonNull(instructions, "instructions cannot be null");
    }

    @Override
    public ReasonerResponse reason(ReasonerRequest request) throws ReasonerException {
        String prompt = instructions + "\nRequest:\n" + codec.encode(request) + "\n";
        String answer;
        try {
            answer = transport.complete(prompt);
        } catch (IOException e) {
            throw new ReasonerException("Completion transport failed: " + e.getMessage(), e);
        }
        return codec.decode(answer);
    }
}
