package com.adlanda.queryagent.service;

import com.adlanda.queryagent.exception.UpstreamCapabilityException;
import com.adlanda.queryagent.model.Chunk;
import com.adlanda.queryagent.model.RetrievedContext;
import com.adlanda.queryagent.model.ScoredChunk;
import com.adlanda.queryagent.model.WeatherPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SynthesisServiceTest {

    @Mock
    private CompletionService completionService;

    @InjectMocks
    private SynthesisService synthesisService;

    @Test
    void synthesize_emptyContext_returnsInsufficientContextAnswerWithoutCallingModel() {
        String answer = synthesisService.synthesize("What is RAG?", RetrievedContext.empty());

        assertThat(answer).isEqualTo(SynthesisService.insufficientContextAnswer("What is RAG?"));
        assertThat(answer).contains("What is RAG?");
        verifyNoInteractions(completionService);
    }

    @Test
    void synthesize_nullContext_returnsInsufficientContextAnswer() {
        String answer = synthesisService.synthesize("anything", null);

        assertThat(answer).startsWith("I could not find any relevant information");
        verifyNoInteractions(completionService);
    }

    @Test
    void synthesize_retrievedContext_sendsQueryAndContextVerbatim() {
        RetrievedContext context = new RetrievedContext(List.of(
                new ScoredChunk(new Chunk("a", "Attention weighs tokens.", 0), 0.9),
                new ScoredChunk(new Chunk("b", "Heads run in parallel.", 1), 0.7)));
        when(completionService.complete(anyString(), anyString())).thenReturn("Attention weighs tokens in parallel heads.");

        String answer = synthesisService.synthesize("How does attention work?", context);

        assertThat(answer).isEqualTo("Attention weighs tokens in parallel heads.");
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(completionService).complete(eq(SynthesisService.SYSTEM_PROMPT), user.capture());
        assertThat(user.getValue())
                .startsWith("Question: How does attention work?")
                .contains("Attention weighs tokens.\n\nHeads run in parallel.");
    }

    @Test
    void synthesize_weatherPayload_rendersObservation() {
        WeatherPayload weather = new WeatherPayload("Berlin", 21.5, "clear sky", null, 40, null, "metric");
        when(completionService.complete(anyString(), anyString())).thenReturn("Sunny and 21.5 °C.");

        synthesisService.synthesize("Temperature in Berlin?", weather);

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(completionService).complete(anyString(), user.capture());
        assertThat(user.getValue())
                .contains("Location: Berlin")
                .contains("Temperature: 21.5")
                .contains("Condition: clear sky");
    }

    @Test
    void synthesize_completionFails_propagates() {
        RetrievedContext context = new RetrievedContext(List.of(
                new ScoredChunk(new Chunk("a", "text", 0), 0.5)));
        when(completionService.complete(anyString(), anyString()))
                .thenThrow(new UpstreamCapabilityException("completion", "timeout"));

        assertThatThrownBy(() -> synthesisService.synthesize("q", context))
                .isInstanceOf(UpstreamCapabilityException.class)
                .hasMessageContaining("timeout");
    }
}
