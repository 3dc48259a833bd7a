package ru.tigran.chatanalytics.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import ru.tigran.chatanalytics.exception.AIGatewayException;
import ru.tigran.chatanalytics.exception.ErrorCode;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Unit-тесты для AIGatewayService.
 * HTTP заменен MockRestServiceServer, circuit breaker настоящий.
 */
@DisplayName("AIGatewayService unit тесты")
class AIGatewayServiceTest {

    private static final String API_URL = "https://llm.example.com/openai/v1/chat/completions";
    private static final String MODEL = "qwen/qwen3-32b";

    private MockRestServiceServer server;
    private CircuitBreaker circuitBreaker;
    private AIGatewayService service;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        circuitBreaker = CircuitBreaker.ofDefaults("textClassifier");
        service = newService(builder.build(), "test-key");
    }

    // ===== УСПЕШНЫЕ СЦЕНАРИИ =====

    @Test
    @DisplayName("Один промпт -> один POST, возвращается content первого choice")
    void generateReturnsContent() {
        server.expect(requestTo(API_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value(MODEL))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("classify me"))
                .andExpect(jsonPath("$.max_completion_tokens").value(100))
                .andRespond(withSuccess(
                        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  3\\n\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertEquals("3", service.generate("classify me"));
        server.verify();
    }

    // ===== ОШИБКИ =====

    @Test
    @DisplayName("503 от провайдера -> AIGatewayException (retriable)")
    void serviceUnavailable() {
        server.expect(requestTo(API_URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        AIGatewayException ex = assertThrows(AIGatewayException.class, () -> service.generate("q"));

        assertTrue(ex.isRetriable());
        assertEquals(ErrorCode.AI_SERVICE_ERROR.getCode(), ex.getErrorCode());
    }

    @Test
    @DisplayName("400 от провайдера -> AIGatewayException (non-retriable)")
    void badRequest() {
        server.expect(requestTo(API_URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        AIGatewayException ex = assertThrows(AIGatewayException.class, () -> service.generate("q"));

        assertFalse(ex.isRetriable());
    }

    @Test
    @DisplayName("Ответ без content -> INVALID_AI_RESPONSE")
    void missingContent() {
        server.expect(requestTo(API_URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        AIGatewayException ex = assertThrows(AIGatewayException.class, () -> service.generate("q"));

        assertEquals(ErrorCode.INVALID_AI_RESPONSE.getCode(), ex.getErrorCode());
    }

    @Test
    @DisplayName("Нет API ключа -> исключение без HTTP вызова")
    void missingApiKey() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer idle = MockRestServiceServer.bindTo(builder).build();
        AIGatewayService unconfigured = newService(builder.build(), "");

        assertFalse(unconfigured.isConfigured());
        assertThrows(AIGatewayException.class, () -> unconfigured.generate("q"));
        idle.verify();
    }

    @Test
    @DisplayName("Открытый circuit breaker -> исключение без HTTP вызова")
    void openCircuit() {
        circuitBreaker.transitionToOpenState();

        AIGatewayException ex = assertThrows(AIGatewayException.class, () -> service.generate("q"));

        assertTrue(ex.isRetriable());
        assertEquals(CircuitBreaker.State.OPEN, service.circuitState());
        server.verify();
    }

    @Test
    @DisplayName("Разбор content: пробелы обрезаются, битый JSON -> исключение")
    void extractMessageContent() {
        assertEquals("2 because parts",
                service.extractMessageContent("{\"choices\":[{\"message\":{\"content\":\" 2 because parts \"}}]}"));
        assertThrows(AIGatewayException.class, () -> service.extractMessageContent("not json"));
        assertThrows(AIGatewayException.class, () -> service.extractMessageContent(""));
    }

    private AIGatewayService newService(RestClient restClient, String apiKey) {
        return new AIGatewayService(
                restClient, new ObjectMapper(), circuitBreaker, API_URL, apiKey, MODEL, 0.1, 100);
    }
}
