package ru.tigran.chatanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import ru.tigran.chatanalytics.service.AIGatewayService;

/**
 * Startup check of the classifier credentials. A missing key does not stop the service:
 * pain-point clustering then assigns every query to the fallback cluster.
 */
@Slf4j
@Component
public class ClassifierApiKeyValidator implements ApplicationRunner {

    private final AIGatewayService aiGatewayService;

    public ClassifierApiKeyValidator(AIGatewayService aiGatewayService) {
        this.aiGatewayService = aiGatewayService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!aiGatewayService.isConfigured()) {
            log.warn("GROQ_API_KEY is not set: pain-point clustering will put every query into the fallback cluster");
            return;
        }
        log.info("Classifier configured with model {}", aiGatewayService.getModel());
    }
}
