package com.redactai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessage;
import com.openai.models.completions.CompletionUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiCompletionServiceTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private OpenAIClient openAIClient;

    @Mock
    private TokenUsageTracker usageTracker;

    private AiCompletionService service;

    @BeforeEach
    void setUp() {
        service = new AiCompletionService(openAIClient, usageTracker);
    }

    private ChatCompletion completion(Optional<String> content, Optional<CompletionUsage> usage) {
        ChatCompletionMessage message = mock(ChatCompletionMessage.class);
        when(message.content()).thenReturn(content);
        ChatCompletion.Choice choice = mock(ChatCompletion.Choice.class);
        when(choice.message()).thenReturn(message);
        ChatCompletion completion = mock(ChatCompletion.class);
        when(completion.choices()).thenReturn(List.of(choice));
        when(completion.usage()).thenReturn(usage);
        return completion;
    }

    @Test
    @DisplayName("Sends system and user message with the configured model and settings")
    void configured_request() {
        ChatCompletion completion = completion(Optional.of("  []  "), Optional.empty());
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class))).thenReturn(completion);

        LlmCallResult result = service.call("system prompt", "user text");

        assertThat(result.content()).isEqualTo("[]");
        assertThat(result.promptTokens()).isZero();
        ArgumentCaptor<ChatCompletionCreateParams> captor = ArgumentCaptor.forClass(ChatCompletionCreateParams.class);
        verify(openAIClient.chat().completions()).create(captor.capture());
        ChatCompletionCreateParams params = captor.getValue();
        assertThat(params.model()).hasToString("gpt-4o");
        assertThat(params.temperature()).contains(0.0);
        assertThat(params.maxCompletionTokens()).contains(4096L);
        assertThat(params.messages()).hasSize(2);
        verifyNoInteractions(usageTracker);
    }

    @Test
    @DisplayName("Token usage is reported and recorded")
    void usage_recorded() {
        CompletionUsage usage = mock(CompletionUsage.class);
        when(usage.promptTokens()).thenReturn(120L);
        when(usage.completionTokens()).thenReturn(30L);
        when(usage.totalTokens()).thenReturn(150L);
        when(usage.promptTokensDetails()).thenReturn(Optional.empty());
        ChatCompletion completion = completion(Optional.of("[]"), Optional.of(usage));
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class))).thenReturn(completion);

        LlmCallResult result = service.call("system prompt", "user text");

        assertThat(result.promptTokens()).isEqualTo(120);
        assertThat(result.completionTokens()).isEqualTo(30);
        verify(usageTracker).recordUsage(120L, 30L, 0L);
    }

    @Test
    @DisplayName("Empty response content is a detection failure")
    void no_content() {
        ChatCompletion completion = completion(Optional.empty(), Optional.empty());
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class))).thenReturn(completion);

        assertThatThrownBy(() -> service.call("system prompt", "user text"))
                .isInstanceOf(AiDetectionException.class)
                .hasMessageContaining("no content");
    }

    @Test
    @DisplayName("Client errors are wrapped")
    void client_failure() {
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class)))
                .thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> service.call("system prompt", "user text"))
                .isInstanceOf(AiDetectionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
