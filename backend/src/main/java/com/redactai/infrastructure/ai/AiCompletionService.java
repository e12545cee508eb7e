package com.redactai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Pure LLM call wrapper. Detection logic lives in the detectors; this service only
 * performs one blocking chat completion and reports token usage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiCompletionService {

    private final OpenAIClient openAIClient;
    private final TokenUsageTracker usageTracker;

    @Value("${openai.model:gpt-4o}")
    private String model = "gpt-4o";

    @Value("${openai.temperature:0}")
    private double temperature = 0;

    @Value("${openai.max-tokens:4096}")
    private int maxTokens = 4096;

    /**
     * One chat completion with the configured model, temperature and token limit.
     *
     * @throws AiDetectionException when the call fails or the response has no content
     */
    public LlmCallResult call(String systemPrompt, String userMessage) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        model, promptTokens, completionTokens, usage.totalTokens());
                long cachedTokens = usage.promptTokensDetails()
                        .map(d -> d.cachedTokens().orElse(0L))
                        .orElse(0L);
                usageTracker.recordUsage(promptTokens, completionTokens, cachedTokens);
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AiDetectionException("OpenAI response contained no content"));

            return new LlmCallResult(content.trim(), promptTokens, completionTokens);
        } catch (AiDetectionException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI API call failed [{}]: {}", model, e.getMessage());
            throw new AiDetectionException("AI detection service is temporarily unavailable", e);
        }
    }
}
