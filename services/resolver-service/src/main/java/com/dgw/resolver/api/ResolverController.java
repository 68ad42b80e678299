package com.dgw.resolver.api;

import com.dgw.resolver.api.dto.DownloadResponse;
import com.dgw.resolver.api.dto.ReleaseView;
import com.dgw.resolver.api.dto.ResolveRequest;
import com.dgw.resolver.api.dto.ResolveResponse;
import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.service.DownloadService;
import com.dgw.resolver.service.ReleaseResolutionService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ResolverController {
    private final ReleaseResolutionService resolutionService;
    private final DownloadService downloadService;

    public ResolverController(ReleaseResolutionService resolutionService, DownloadService downloadService) {
        this.resolutionService = resolutionService;
        this.downloadService = downloadService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/resolve")
    public ResolveResponse resolve(@RequestBody(required = false) ResolveRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        MediaKind kind = MediaKind.from(request.getKind());
        if (kind == null) {
            throw new IllegalArgumentException("kind must be movie or show");
        }
        MediaTarget target = MediaTarget.of(kind, request.getExternalId(), request.getSeasons(), request.getEpisode());
        return ResolveResponse.from(resolutionService.resolve(target, request.getProfiles()));
    }

    @GetMapping("/search")
    public ResolveResponse search(
        @RequestParam("query") String query,
        @RequestParam(value = "profiles", required = false) List<String> profiles
    ) {
        if (query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        return ResolveResponse.from(resolutionService.resolveSearch(query, profiles));
    }

    @GetMapping("/handles/{handle}/{offset}")
    public ReleaseView release(@PathVariable("handle") String handle, @PathVariable("offset") int offset) {
        return ReleaseView.from(resolutionService.selectForDownload(handle, offset));
    }

    @PostMapping("/handles/{handle}/{offset}/download")
    public DownloadResponse download(@PathVariable("handle") String handle, @PathVariable("offset") int offset) {
        return DownloadResponse.from(downloadService.downloadFrom(handle, offset));
    }
}
