package com.dgw.resolver.debrid;

import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.Version;
import com.dgw.resolver.resilience.ExternalCallException;
import com.dgw.resolver.resilience.OutboundCallExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

@Component
public class RealDebridGateway implements CacheLookup, DownloadClient {
    private static final Logger log = LoggerFactory.getLogger(RealDebridGateway.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RealDebridProperties properties;
    private final OutboundCallExecutor callExecutor;

    public RealDebridGateway(
        @Qualifier("realDebridRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        RealDebridProperties properties,
        OutboundCallExecutor callExecutor
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.callExecutor = callExecutor;
    }

    @Override
    public String providerCode() {
        return properties.getProviderCode();
    }

    @Override
    public Map<String, List<Map<String, CachedFile>>> checkAvailability(List<String> hashes) {
        Map<String, List<Map<String, CachedFile>>> available = new LinkedHashMap<>();
        if (hashes == null || hashes.isEmpty()) {
            return available;
        }
        String url = buildUrl("/torrents/instantAvailability/" + String.join("/", hashes));
        JsonNode root = callExecutor.execute("realdebrid_availability", properties.getRetry(),
            () -> exchangeJson("realdebrid_availability", url, HttpMethod.GET, null));
        if (root == null || !root.isObject()) {
            return available;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode groups = field.getValue().path("rd");
            if (!groups.isArray()) {
                continue;
            }
            List<Map<String, CachedFile>> fileGroups = new ArrayList<>();
            for (JsonNode group : groups) {
                Map<String, CachedFile> files = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> entries = group.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    files.put(entry.getKey(), new CachedFile(
                        entry.getValue().path("filename").asText(""),
                        entry.getValue().path("filesize").asLong(0L)
                    ));
                }
                fileGroups.add(files);
            }
            available.put(field.getKey().toLowerCase(Locale.ROOT), fileGroups);
        }
        return available;
    }

    /**
     * Adds the magnet and tries each version's file selection in order. A selection whose link count does not
     * match the selected file count is packed as an archive; that torrent is deleted and the next version tried.
     * Once a selection matches, the torrent is kept even if unrestricting its links fails.
     */
    @Override
    public Optional<DownloadReceipt> download(Candidate candidate) {
        for (Version version : candidate.getVersions()) {
            List<String> fileIds = version.fileIds();
            if (fileIds.isEmpty()) {
                continue;
            }
            String torrentId;
            try {
                torrentId = addMagnet(candidate.getMagnet());
            } catch (ExternalCallException e) {
                log.warn("add magnet failed title={}", candidate.getTitle(), e);
                return Optional.empty();
            }
            JsonNode info;
            List<String> links = new ArrayList<>();
            try {
                selectFiles(torrentId, fileIds);
                info = torrentInfo(torrentId);
                for (JsonNode link : info.path("links")) {
                    links.add(link.asText());
                }
                if (links.size() != fileIds.size()) {
                    log.warn("file selection is packed as an archive, trying next version title={}",
                        candidate.getTitle());
                    deleteTorrent(torrentId);
                    continue;
                }
            } catch (ExternalCallException e) {
                log.warn("file selection failed title={} torrent={}", candidate.getTitle(), torrentId, e);
                deleteQuietly(torrentId);
                continue;
            }
            try {
                for (String link : links) {
                    unrestrict(link);
                }
            } catch (ExternalCallException e) {
                log.warn("unrestrict failed title={} torrent={}", candidate.getTitle(), torrentId, e);
                return Optional.empty();
            }
            log.info("added to realdebrid title={} torrent={} remote_name={}", candidate.getTitle(), torrentId,
                info.path("filename").asText(""));
            return Optional.of(new DownloadReceipt(torrentId, candidate.getTitle(), links));
        }
        return Optional.empty();
    }

    private String addMagnet(String magnet) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("magnet", magnet);
        JsonNode response = callExecutor.execute("realdebrid_add_magnet", properties.getRetry(),
            () -> exchangeJson("realdebrid_add_magnet", buildUrl("/torrents/addMagnet"), HttpMethod.POST, form));
        String id = response == null ? null : response.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new ExternalCallException("realdebrid_add_magnet", "missing_torrent_id");
        }
        return id;
    }

    private void selectFiles(String torrentId, List<String> fileIds) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("files", String.join(",", fileIds));
        callExecutor.execute("realdebrid_select_files", properties.getRetry(),
            () -> exchangeJson("realdebrid_select_files", buildUrl("/torrents/selectFiles/" + torrentId), HttpMethod.POST, form));
    }

    private JsonNode torrentInfo(String torrentId) {
        JsonNode info = callExecutor.execute("realdebrid_info", properties.getRetry(),
            () -> exchangeJson("realdebrid_info", buildUrl("/torrents/info/" + torrentId), HttpMethod.GET, null));
        if (info == null) {
            throw new ExternalCallException("realdebrid_info", "empty_response");
        }
        return info;
    }

    private void unrestrict(String link) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("link", link);
        callExecutor.execute("realdebrid_unrestrict", properties.getRetry(),
            () -> exchangeJson("realdebrid_unrestrict", buildUrl("/unrestrict/link"), HttpMethod.POST, form));
    }

    private void deleteTorrent(String torrentId) {
        callExecutor.execute("realdebrid_delete", properties.getRetry(),
            () -> exchangeJson("realdebrid_delete", buildUrl("/torrents/delete/" + torrentId), HttpMethod.DELETE, null));
    }

    private void deleteQuietly(String torrentId) {
        try {
            deleteTorrent(torrentId);
        } catch (ExternalCallException e) {
            log.warn("cleanup delete failed torrent={}", torrentId, e);
        }
    }

    private JsonNode exchangeJson(String callName, String url, HttpMethod method, MultiValueMap<String, String> form) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getApiKey() == null ? "" : properties.getApiKey());
        HttpEntity<?> entity;
        if (form != null) {
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
            entity = new HttpEntity<>(form, headers);
        } else {
            entity = new HttpEntity<>(headers);
        }
        ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalCallException(callName, "malformed_response", null, e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
