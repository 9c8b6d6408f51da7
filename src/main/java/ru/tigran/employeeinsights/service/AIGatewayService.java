package ru.tigran.employeeinsights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import ru.tigran.employeeinsights.dto.InsightContext;
import ru.tigran.employeeinsights.exception.AIGatewayException;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.RetriableHttpException;

/**
 * OpenAI-compatible chat completions client (OpenRouter by default) that writes page conclusions.
 */
@Slf4j
@Service
public class AIGatewayService implements NarrativeGenerator {

    // Maximum backoff delay per retry
    private static final long MAX_BACKOFF_MS = 8000;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final int maxRetries;
    private final long retryDelayMs;
    private final int retryBackoffMultiplier;

    public AIGatewayService(
            @Qualifier("aiRestClient") RestClient restClient,
            ObjectMapper objectMapper,
            @Qualifier("narrativeProviderCircuitBreaker") CircuitBreaker circuitBreaker,
            @Value("${app.ai.api-url:https://openrouter.ai/api/v1/chat/completions}") String apiUrl,
            @Value("${app.ai.api-key:}") String apiKey,
            @Value("${app.ai.model:openai/gpt-4o-mini}") String model,
            @Value("${app.ai.max-retries:3}") int maxRetries,
            @Value("${app.ai.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${app.ai.retry-backoff-multiplier:2}") int retryBackoffMultiplier
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryDelayMs = retryDelayMs;
        this.retryBackoffMultiplier = retryBackoffMultiplier;
    }

    @Override
    public String generate(InsightContext context) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new AIGatewayException(
                    "AI provider API key is not configured",
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                    false
            );
        }

        log.info("Generating conclusion for page '{}' over {} records", context.page(), context.totalRecords());
        String systemPrompt = NarrativePromptBuilder.buildSystemPrompt();
        String userMessage = NarrativePromptBuilder.buildUserPrompt(context);

        try {
            return circuitBreaker.executeSupplier(() -> callAIProvider(systemPrompt, userMessage));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker '{}' is open, rejecting conclusion request", circuitBreaker.getName());
            throw new AIGatewayException(
                    "AI provider is temporarily unavailable",
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                    true,
                    e
            );
        }
    }

    private String callAIProvider(String systemPrompt, String userMessage) {
        String requestBody = buildRequestBody(systemPrompt, userMessage);

        int attempt = 0;
        while (true) {
            try {
                log.debug("callAIProvider - attempt {}/{}, model={}", attempt + 1, maxRetries, model);

                String response = restClient.post()
                        .uri(apiUrl)
                        .header("Authorization", "Bearer " + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(requestBody)
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, (request, httpResponse) -> {
                            int statusCode = httpResponse.getStatusCode().value();

                            // 429, 502, 503, 504 are worth another attempt
                            if (statusCode == 429 || statusCode == 502 || statusCode == 503 || statusCode == 504) {
                                log.warn("Retriable HTTP error {} from AI provider", statusCode);
                                throw new RetriableHttpException(statusCode,
                                        "Retriable error from AI provider: " + statusCode);
                            }

                            log.error("AI provider error: {} {}", statusCode, httpResponse.getStatusText());
                            throw new AIGatewayException(
                                    "AI provider error: " + statusCode,
                                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                                    false
                            );
                        })
                        .body(String.class);

                String content = extractMessageContent(response);
                log.info("AI provider returned conclusion of {} chars (attempt {}/{})",
                        content.length(), attempt + 1, maxRetries);
                return content;

            } catch (RetriableHttpException e) {
                attempt++;
                if (attempt >= maxRetries) {
                    throw new AIGatewayException(
                            "Max retries exceeded for retriable HTTP error: " + e.getStatusCode(),
                            ErrorCode.AI_SERVICE_ERROR.getCode(),
                            true,
                            e
                    );
                }
                backoff(attempt);
            } catch (RestClientException e) {
                log.error("Error calling AI provider", e);
                throw new AIGatewayException(
                        "Failed to call AI provider: " + e.getMessage(),
                        ErrorCode.AI_SERVICE_ERROR.getCode(),
                        false,
                        e
                );
            }
        }
    }

    private void backoff(int attempt) {
        long backoffMs = retryDelayMs * (long) Math.pow(retryBackoffMultiplier, attempt - 1);
        backoffMs = Math.min(backoffMs, MAX_BACKOFF_MS);
        log.info("Retrying after {} ms (attempt {}/{})", backoffMs, attempt, maxRetries);
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AIGatewayException(
                    "Interrupted during retry",
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    false,
                    ie
            );
        }
    }

    private String buildRequestBody(String systemPrompt, String userMessage) {
        var rootNode = objectMapper.createObjectNode();
        rootNode.put("model", model);

        var messages = rootNode.putArray("messages");
        var systemMessage = messages.addObject();
        systemMessage.put("role", "system");
        systemMessage.put("content", systemPrompt);
        var userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", userMessage);

        try {
            return objectMapper.writeValueAsString(rootNode);
        } catch (JsonProcessingException e) {
            throw new AIGatewayException(
                    "Failed to build request body",
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    false,
                    e
            );
        }
    }

    /**
     * Pulls {@code choices[0].message.content} out of a chat completions response.
     */
    String extractMessageContent(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new AIGatewayException("Empty response from AI provider",
                    ErrorCode.AI_SERVICE_ERROR.getCode(), true);
        }
        try {
            JsonNode content = objectMapper.readTree(responseBody).at("/choices/0/message/content");
            if (content.isMissingNode() || !content.isTextual() || content.asText().isBlank()) {
                throw new AIGatewayException("AI provider response has no message content",
                        ErrorCode.AI_SERVICE_ERROR.getCode(), false);
            }
            return content.asText().trim();
        } catch (JsonProcessingException e) {
            throw new AIGatewayException("Failed to parse AI provider response",
                    ErrorCode.AI_SERVICE_ERROR.getCode(), false, e);
        }
    }
}
