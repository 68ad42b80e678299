package com.dgw.resolver.debrid;

import com.dgw.resolver.common.ReleaseTable;
import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.FileEntry;
import com.dgw.resolver.model.Version;
import com.dgw.resolver.parse.ReleaseNameMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AvailabilityMatcher {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityMatcher.class);
    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    static final Comparator<Version> PRIMARY_ORDER = Comparator
        .comparingInt(Version::getVideoCount)
        .thenComparingDouble(Version::videoRatio)
        .reversed();

    private final CacheLookup cacheLookup;

    public AvailabilityMatcher(CacheLookup cacheLookup) {
        this.cacheLookup = cacheLookup;
    }

    public List<Candidate> match(List<Candidate> candidates) {
        List<Candidate> available = new ArrayList<>();
        if (candidates == null || candidates.isEmpty()) {
            return available;
        }
        List<String> hashes = candidates.stream().map(Candidate::getHash).toList();
        Map<String, List<Map<String, CachedFile>>> response = cacheLookup.checkAvailability(hashes);

        for (Candidate candidate : candidates) {
            List<Map<String, CachedFile>> groups = response.get(candidate.getHash());
            if (groups == null || groups.isEmpty()) {
                continue;
            }
            List<Version> versions = new ArrayList<>(groups.size());
            for (Map<String, CachedFile> group : groups) {
                versions.add(toVersion(group));
            }
            // stable: equal versions keep report order
            versions.sort(PRIMARY_ORDER);
            candidate.setVersions(versions);
            candidate.promote(versions.get(0));
            candidate.addCachedProvider(cacheLookup.providerCode());
            available.add(candidate);
        }
        log.info("cache check done provider={} checked={} available={}",
            cacheLookup.providerCode(), candidates.size(), available.size());
        if (log.isInfoEnabled()) {
            ReleaseTable.render(available).forEach(log::info);
        }
        return available;
    }

    static Version toVersion(Map<String, CachedFile> group) {
        List<FileEntry> files = new ArrayList<>(group.size());
        for (Map.Entry<String, CachedFile> entry : group.entrySet()) {
            files.add(classify(entry.getKey(), entry.getValue()));
        }
        return new Version(files);
    }

    static FileEntry classify(String id, CachedFile file) {
        String name = file.filename() == null ? "" : file.filename();
        return new FileEntry(
            name,
            file.filesizeBytes() / BYTES_PER_GB,
            id,
            ReleaseNameMatcher.isVideo(name),
            ReleaseNameMatcher.isSubtitle(name),
            ReleaseNameMatcher.season(name),
            ReleaseNameMatcher.episode(name)
        );
    }
}
