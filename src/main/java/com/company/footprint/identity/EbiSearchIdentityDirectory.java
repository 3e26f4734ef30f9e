package com.company.footprint.identity;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.exception.IdentityLookupException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Staff directory backed by the EBI Search people index.
 */
@Component
@ConditionalOnProperty(prefix = "footprint.identity", name = "enabled", havingValue = "true")
@Slf4j
public class EbiSearchIdentityDirectory implements IdentityDirectory {

    static final String EXCLUDED_POSITION = "Staff Association Representative";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final FootprintProperties.IdentityConfig config;

    public EbiSearchIdentityDirectory(RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper,
                                      MeterRegistry meterRegistry, FootprintProperties properties) {
        this.config = properties.getIdentity();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    @Retry(name = "identityLookup", fallbackMethod = "lookupFallback")
    public Optional<IdentityRecord> lookup(String login) {
        String url = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .queryParam("query", login)
                .queryParam("size", 100)
                .queryParam("format", "JSON")
                .queryParam("fields", "email,full_name,photo,positions")
                .toUriString();

        String payload;
        try {
            payload = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            throw new IdentityLookupException(login, e);
        }

        if (payload == null) {
            return Optional.empty();
        }

        try {
            return parse(login, objectMapper.readTree(payload));
        } catch (IOException e) {
            throw new IdentityLookupException(login, e);
        }
    }

    private Optional<IdentityRecord> lookupFallback(String login, Exception e) {
        log.warn("Identity lookup for {} failed, keeping stored metadata: {}", login, e.getMessage());
        meterRegistry.counter("identity.lookup.failures").increment();
        return Optional.empty();
    }

    /**
     * Pick the entry whose email is exactly the login at the organisation's domain.
     * Positions read "title|team"; the first non-empty title is the position.
     */
    Optional<IdentityRecord> parse(String login, JsonNode root) {
        String expectedEmail = login + "@" + config.getEmailDomain();

        for (JsonNode entry : root.path("entries")) {
            JsonNode fields = entry.path("fields");

            if (!expectedEmail.equals(first(fields, "email"))) {
                continue;
            }

            String position = null;
            List<String> teams = new ArrayList<>();
            for (JsonNode value : fields.path("positions")) {
                String text = value.asText();
                if (text.contains(EXCLUDED_POSITION)) {
                    continue;
                }

                String[] parts = text.split("\\|");
                String title = parts[0].trim();
                if (position == null && !title.isEmpty()) {
                    position = title;
                }
                if (parts.length > 1 && !parts[1].trim().isEmpty()) {
                    teams.add(parts[1].trim());
                }
            }

            return Optional.of(IdentityRecord.builder()
                    .name(first(fields, "full_name"))
                    .position(position)
                    .teams(teams)
                    .photoUrl(first(fields, "photo"))
                    .build());
        }

        return Optional.empty();
    }

    private static String first(JsonNode fields, String name) {
        JsonNode values = fields.path(name);
        if (values.isArray() && !values.isEmpty()) {
            return values.get(0).asText();
        }
        return null;
    }
}
