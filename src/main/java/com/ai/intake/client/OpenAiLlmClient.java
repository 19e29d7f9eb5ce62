package com.ai.intake.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenAI Chat Completions. One retry, and only for transient I/O failures.
 */
@Component
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private static final int MAX_ATTEMPTS = 2;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${openai.api-key:${OPENAI_API_KEY:}}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${openai.url:https://api.openai.com/v1/chat/completions}")
    private String url;

    public OpenAiLlmClient(RestTemplateBuilder builder,
                           @Value("${openai.connect-timeout:1s}") Duration connectTimeout,
                           @Value("${openai.read-timeout:2s}") Duration readTimeout) {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Override
    public Optional<String> complete(String instruction, String transcript) {
        if (StringUtils.isBlank(openAiApiKey)) {
            log.debug("OPENAI_API_KEY is not set, skipping LLM layer");
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("temperature", 0);
        body.put("max_tokens", 40);
        body.put("messages", List.of(
                Map.of("role", "system", "content", instruction),
                Map.of("role", "user", "content", transcript)));
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(body, headers);

        ResponseEntity<String> response = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                response = restTemplate.postForEntity(url, request, String.class);
                break;
            } catch (ResourceAccessException e) {
                if (attempt < MAX_ATTEMPTS && !Thread.currentThread().isInterrupted()) {
                    log.warn("LLM attempt {}/{} failed ({}), retrying", attempt, MAX_ATTEMPTS, e.getMessage());
                } else {
                    log.warn("LLM failed after {} attempts: {}", attempt, e.getMessage());
                    return Optional.empty();
                }
            } catch (RestClientException e) {
                log.warn("LLM request rejected: {}", e.getMessage());
                return Optional.empty();
            }
        }
        if (response == null || response.getBody() == null) return Optional.empty();

        try {
            JsonNode root = mapper.readTree(response.getBody());
            String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
            return content.isEmpty() ? Optional.empty() : Optional.of(content);
        } catch (Exception ex) {
            log.error("Failed to read LLM reply", ex);
            return Optional.empty();
        }
    }
}
