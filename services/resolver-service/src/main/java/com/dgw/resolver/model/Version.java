package com.dgw.resolver.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class Version {
    private final List<FileEntry> files;
    private final double totalSizeGb;
    private final int videoCount;
    private final int subtitleCount;
    private final int episodeCount;
    private final Set<Integer> seasons;

    public Version(List<FileEntry> files) {
        this.files = files == null ? List.of() : List.copyOf(files);
        double size = 0.0;
        int videos = 0;
        int subtitles = 0;
        int episodes = 0;
        Set<Integer> seen = new LinkedHashSet<>();
        for (FileEntry file : this.files) {
            size += file.sizeGb();
            if (file.video()) {
                videos++;
                if (file.season() != null) {
                    seen.add(file.season());
                }
                if (file.episode() != null) {
                    episodes++;
                }
            }
            if (file.subtitle()) {
                subtitles++;
            }
        }
        this.totalSizeGb = size;
        this.videoCount = videos;
        this.subtitleCount = subtitles;
        this.episodeCount = episodes;
        this.seasons = Collections.unmodifiableSet(seen);
    }

    public List<FileEntry> getFiles() {
        return files;
    }

    public int fileCount() {
        return files.size();
    }

    public double getTotalSizeGb() {
        return totalSizeGb;
    }

    public int getVideoCount() {
        return videoCount;
    }

    public int getSubtitleCount() {
        return subtitleCount;
    }

    public int getEpisodeCount() {
        return episodeCount;
    }

    public Set<Integer> getSeasons() {
        return seasons;
    }

    public double videoRatio() {
        return files.isEmpty() ? 0.0 : (double) videoCount / files.size();
    }

    public List<String> fileIds() {
        return files.stream().map(FileEntry::id).toList();
    }
}
