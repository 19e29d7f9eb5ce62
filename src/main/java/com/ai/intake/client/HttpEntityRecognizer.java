package com.ai.intake.client;

import com.ai.intake.config.IntakeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Calls an external NER service: POST {"text": ...} answered by {"entities": [{"label", "text"}]}.
 * Errors propagate; the extraction pipeline treats them as a layer failure.
 */
@Component
public class HttpEntityRecognizer implements EntityRecognizer {

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String url;

    public HttpEntityRecognizer(RestTemplateBuilder builder, IntakeProperties properties) {
        IntakeProperties.Ner ner = properties.getNer();
        this.url = ner.getUrl();
        this.restTemplate = builder
                .setConnectTimeout(ner.getTimeout())
                .setReadTimeout(ner.getTimeout())
                .build();
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.isNotBlank(url);
    }

    @Override
    public List<String> findPersons(String text) {
        if (!isEnabled()) return List.of();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = restTemplate.postForObject(url, new HttpEntity<>(Map.of("text", text), headers), String.class);
        if (body == null) return List.of();

        List<String> persons = new ArrayList<>();
        try {
            for (JsonNode entity : mapper.readTree(body).path("entities")) {
                if ("PERSON".equalsIgnoreCase(entity.path("label").asText())) {
                    String value = entity.path("text").asText("").trim();
                    if (!value.isEmpty()) persons.add(value);
                }
            }
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable NER response", e);
        }
        return persons;
    }
}
