package com.dgw.resolver.source;

import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.RawRelease;
import com.dgw.resolver.resilience.ExternalCallException;
import com.dgw.resolver.resilience.OutboundCallExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class TorrentioGateway implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(TorrentioGateway.class);
    private static final String CALL_NAME = "torrentio_stream";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TorrentioProperties properties;
    private final OutboundCallExecutor callExecutor;

    public TorrentioGateway(
        @Qualifier("torrentioRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        TorrentioProperties properties,
        OutboundCallExecutor callExecutor
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.callExecutor = callExecutor;
    }

    @Override
    public List<RawRelease> search(MediaTarget target) {
        String url = buildUrl(streamPath(target));
        JsonNode root = callExecutor.execute(CALL_NAME, properties.getRetry(), () -> getJson(url));
        List<RawRelease> releases = new ArrayList<>();
        JsonNode streams = root == null ? null : root.get("streams");
        if (streams == null || !streams.isArray()) {
            log.info("no streams target={}", target.slotKey());
            return releases;
        }
        for (JsonNode stream : streams) {
            String title = stream.path("title").asText(null);
            String infoHash = stream.path("infoHash").asText(null);
            releases.add(new RawRelease(title, infoHash));
        }
        log.info("scraped target={} entries={}", target.slotKey(), releases.size());
        return releases;
    }

    String streamPath(MediaTarget target) {
        if (target.getKind() == MediaKind.MOVIE) {
            return "/stream/movie/" + target.getExternalId() + ".json";
        }
        int season = target.getSeasons().isEmpty() ? 1 : target.getSeasons().first();
        int episode = target.getEpisode() == null ? 1 : target.getEpisode();
        return "/stream/series/" + target.getExternalId() + ":" + season + ":" + episode + ".json";
    }

    private JsonNode getJson(String url) {
        ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET, HttpEntity.EMPTY, String.class);
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

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String options = properties.getOptions();
        if (options == null || options.isBlank()) {
            return base + path;
        }
        return base + "/" + options + path;
    }
}
