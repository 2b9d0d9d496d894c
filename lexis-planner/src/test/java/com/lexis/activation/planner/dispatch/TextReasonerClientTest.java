package com.lexis.activation.planner.dispatch;

import com.lexis.activation.api.exceptions.ReasonerException;
import com.lexis.activation.api.model.ContentModule;
import com.lexis.activation.api.model.ReasonerRequest;
import com.lexis.activation.api.model.ReasonerResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextReasonerClientTest {

    private static final ReasonerRequest REQUEST = new ReasonerRequest("parecer_cirurgico",
            List.of(ReasonerRequest.ModuleBrief.of(ContentModule.llm("analise_medica", "Controversia clinica", 1))),
            Map.of());

    @Mock
    private CompletionTransport transport;

    @Test
    @DisplayName("Should send instructions and the encoded request, then decode the answer")
    void shouldRoundTripThroughTransport() throws Exception {
        when(transport.complete(anyString()))
                .thenReturn("```json\n{\"verdicts\": [{\"id\": \"analise_medica\", \"activate\": true}]}\n```");

        ReasonerResponse response = new TextReasonerClient(transport).reason(REQUEST);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(transport).complete(prompt.capture());
        assertThat(prompt.getValue())
                .startsWith(TextReasonerClient.DEFAULT_INSTRUCTIONS)
                .contains("\"id\" : \"analise_medica\"");
        assertThat(response.verdicts()).singleElement()
                .satisfies(v -> assertThat(v.activate()).isTrue());
    }

    @Test
    @DisplayName("Should wrap transport failures as ReasonerException")
    void shouldWrapTransportFailures() throws Exception {
        when(transport.complete(anyString())).thenThrow(new IOException("503 Service Unavailable"));

        assertThatThrownBy(() -> new TextReasonerClient(transport).reason(REQUEST))
                .isInstanceOf(ReasonerException.class)
                .hasMessageContaining("503")
                .hasCauseInstanceOf(IOException.class);
    }
}
