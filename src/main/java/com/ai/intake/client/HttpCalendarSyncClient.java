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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * POSTs the event to a calendar service and reads back {"id": ...}. Transport errors propagate to the caller.
 */
@Component
public class HttpCalendarSyncClient implements CalendarSyncClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final IntakeProperties.Calendar settings;

    public HttpCalendarSyncClient(RestTemplateBuilder builder, IntakeProperties properties) {
        this.settings = properties.getCalendar();
        this.restTemplate = builder
                .setConnectTimeout(settings.getTimeout())
                .setReadTimeout(settings.getTimeout())
                .build();
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.isNotBlank(settings.getUrl());
    }

    @Override
    public Optional<String> createEvent(CalendarEvent event) {
        if (!isEnabled()) return Optional.empty();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(settings.getApiKey())) {
            headers.setBearerAuth(settings.getApiKey());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("summary", event.title());
        body.put("description", event.description());
        body.put("start", event.startUtc().toString());
        body.put("end", event.startUtc().plusSeconds(event.durationMinutes() * 60L).toString());
        body.put("source_call_id", event.sourceCallId());

        String response = restTemplate.postForObject(settings.getUrl(), new HttpEntity<>(body, headers), String.class);
        if (response == null) return Optional.empty();
        try {
            JsonNode id = mapper.readTree(response).path("id");
            return id.isMissingNode() || id.asText().isBlank() ? Optional.empty() : Optional.of(id.asText());
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable calendar response", e);
        }
    }
}
