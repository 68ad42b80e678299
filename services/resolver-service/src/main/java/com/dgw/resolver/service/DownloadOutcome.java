package com.dgw.resolver.service;

import com.dgw.resolver.debrid.DownloadReceipt;
import com.dgw.resolver.model.Candidate;

public record DownloadOutcome(boolean downloaded, Candidate candidate, int offset, DownloadReceipt receipt) {
    static DownloadOutcome failed(int startOffset) {
        return new DownloadOutcome(false, null, startOffset, null);
    }
}
