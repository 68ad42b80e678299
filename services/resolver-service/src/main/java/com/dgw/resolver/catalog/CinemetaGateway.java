package com.dgw.resolver.catalog;

import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.resilience.ExternalCallException;
import com.dgw.resolver.resilience.OutboundCallExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class CinemetaGateway {
    private static final String CALL_NAME = "cinemeta_catalog";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CinemetaProperties properties;
    private final OutboundCallExecutor callExecutor;

    public CinemetaGateway(
        @Qualifier("cinemetaRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        CinemetaProperties properties,
        OutboundCallExecutor callExecutor
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.callExecutor = callExecutor;
    }

    public Optional<String> findImdbId(MediaKind kind, String title) {
        URI uri = catalogUri(kind, title);
        JsonNode root = callExecutor.execute(CALL_NAME, properties.getRetry(), () -> getJson(uri));
        if (root == null) {
            return Optional.empty();
        }
        for (JsonNode meta : root.path("metas")) {
            String imdbId = meta.path("imdb_id").asText(null);
            if (imdbId == null || imdbId.isBlank()) {
                imdbId = meta.path("id").asText(null);
            }
            if (imdbId != null && !imdbId.isBlank()) {
                return Optional.of(imdbId);
            }
        }
        return Optional.empty();
    }

    URI catalogUri(MediaKind kind, String title) {
        String catalog = kind == MediaKind.SHOW ? "series" : "movie";
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return UriComponentsBuilder.fromHttpUrl(base)
            .path("/catalog/{catalog}/top/search={title}.json")
            .encode()
            .buildAndExpand(catalog, title)
            .toUri();
    }

    private JsonNode getJson(URI uri) {
        ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, HttpEntity.EMPTY, String.class);
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalCallException(CALL_NAME, "malformed_response", null, e);
        }
    }
}
