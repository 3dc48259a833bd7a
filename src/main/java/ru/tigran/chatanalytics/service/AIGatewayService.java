package ru.tigran.chatanalytics.service;

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
import ru.tigran.chatanalytics.exception.AIGatewayException;
import ru.tigran.chatanalytics.exception.ErrorCode;
import ru.tigran.chatanalytics.service.clustering.TextClassifier;

/**
 * Text classifier backed by an OpenAI-compatible chat completions API (Groq by default).
 *
 * One prompt is one request: a single user message, low temperature, bounded completion length.
 * Calls run through the {@code textClassifier} circuit breaker and are never retried here.
 */
@Slf4j
@Service
public class AIGatewayService implements TextClassifier {

    // Maximum response size (1 MB) to prevent memory exhaustion
    private static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxCompletionTokens;

    public AIGatewayService(
            RestClient restClient,
            ObjectMapper objectMapper,
            @Qualifier("textClassifierCircuitBreaker") CircuitBreaker circuitBreaker,
            @Value("${app.classifier.api-url}") String apiUrl,
            @Value("${app.classifier.api-key:}") String apiKey,
            @Value("${app.classifier.model}") String model,
            @Value("${app.classifier.temperature:0.1}") double temperature,
            @Value("${app.classifier.max-completion-tokens:100}") int maxCompletionTokens
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getModel() {
        return model;
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    /**
     * Sends the prompt and returns the raw message content of the first choice.
     *
     * @throws AIGatewayException on missing key, open circuit, HTTP error or malformed response
     */
    @Override
    public String generate(String prompt) {
        if (!isConfigured()) {
            throw new AIGatewayException(
                    "Classifier API key is not configured",
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    false
            );
        }

        try {
            return circuitBreaker.executeSupplier(() -> callProvider(prompt));
        } catch (CallNotPermittedException e) {
            throw new AIGatewayException(
                    "Classifier circuit breaker is open",
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    true,
                    e
            );
        }
    }

    private String callProvider(String prompt) {
        String requestBody = buildRequestBody(prompt);
        String response;
        try {
            response = restClient.post()
                    .uri(apiUrl)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                        int statusCode = errorResponse.getStatusCode().value();
                        boolean retriable = statusCode == 429 || statusCode == 502
                                || statusCode == 503 || statusCode == 504;
                        log.error("Classifier API error: {} {} (retriable={})",
                                statusCode, errorResponse.getStatusText(), retriable);
                        throw new AIGatewayException(
                                "Classifier API error: " + statusCode,
                                ErrorCode.AI_SERVICE_ERROR.getCode(),
                                retriable
                        );
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new AIGatewayException(
                    "Classifier API call failed: " + e.getMessage(),
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    true,
                    e
            );
        }

        String content = extractMessageContent(response);
        log.debug("Classifier model {} answered with {} chars", model, content.length());
        return content;
    }

    private String buildRequestBody(String prompt) {
        var rootNode = objectMapper.createObjectNode();
        rootNode.put("model", model);
        rootNode.put("temperature", temperature);
        rootNode.put("max_completion_tokens", maxCompletionTokens);
        rootNode.put("stream", false);

        var userMessage = rootNode.putArray("messages").addObject();
        userMessage.put("role", "user");
        userMessage.put("content", prompt);

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
     * Validates that API response size doesn't exceed maximum allowed size.
     */
    private void validateResponseSize(String responseBody) {
        if (responseBody != null && responseBody.length() > MAX_RESPONSE_SIZE_BYTES) {
            String errorMsg = String.format(
                    "Classifier response exceeds maximum allowed size: %d bytes, max allowed: %d bytes",
                    responseBody.length(),
                    MAX_RESPONSE_SIZE_BYTES
            );
            log.error(errorMsg);
            throw new AIGatewayException(errorMsg, ErrorCode.INVALID_AI_RESPONSE.getCode(), false);
        }
    }

    /**
     * Extracts {@code choices[0].message.content} from the completion response.
     */
    String extractMessageContent(String response) {
        validateResponseSize(response);
        if (response == null || response.isBlank()) {
            throw new AIGatewayException("Empty classifier response", ErrorCode.INVALID_AI_RESPONSE.getCode(), false);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new AIGatewayException(
                    "Failed to parse classifier response: " + e.getOriginalMessage(),
                    ErrorCode.INVALID_AI_RESPONSE.getCode(),
                    false,
                    e
            );
        }

        JsonNode content = root.at("/choices/0/message/content");
        if (content.isMissingNode() || content.isNull()) {
            log.error("Missing content in classifier response. Preview: {}",
                    response.length() > 200 ? response.substring(0, 200) : response);
            throw new AIGatewayException(
                    "Missing content in classifier response",
                    ErrorCode.INVALID_AI_RESPONSE.getCode(),
                    false
            );
        }
        return content.asText().strip();
    }
}
