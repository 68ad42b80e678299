package com.dgw.resolver.debrid;

import java.util.List;

public record DownloadReceipt(String torrentId, String filename, List<String> links) {
    public DownloadReceipt {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
