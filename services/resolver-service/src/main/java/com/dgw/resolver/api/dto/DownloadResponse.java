package com.dgw.resolver.api.dto;

import com.dgw.resolver.service.DownloadOutcome;

public class DownloadResponse {
    private boolean downloaded;
    private ReleaseView release;
    private int offset;

    public static DownloadResponse from(DownloadOutcome outcome) {
        DownloadResponse response = new DownloadResponse();
        response.downloaded = outcome.downloaded();
        response.release = outcome.candidate() == null ? null : ReleaseView.from(outcome.candidate());
        response.offset = outcome.offset();
        return response;
    }

    public boolean isDownloaded() {
        return downloaded;
    }

    public ReleaseView getRelease() {
        return release;
    }

    public int getOffset() {
        return offset;
    }
}
