package com.dgw.resolver.service;

import com.dgw.resolver.debrid.DownloadClient;
import com.dgw.resolver.debrid.DownloadReceipt;
import com.dgw.resolver.ledger.SelectionLedger;
import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.ResolutionHandle;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DownloadService {
    private static final Logger log = LoggerFactory.getLogger(DownloadService.class);

    private final SelectionLedger ledger;
    private final DownloadClient downloadClient;

    public DownloadService(SelectionLedger ledger, DownloadClient downloadClient) {
        this.ledger = ledger;
        this.downloadClient = downloadClient;
    }

    public DownloadOutcome downloadFrom(String handleId, int offset) {
        ResolutionHandle handle = ledger.find(handleId)
            .orElseThrow(() -> new HandleNotFoundException(handleId, offset));
        List<Candidate> candidates = handle.candidates();
        if (offset < 0 || offset >= candidates.size()) {
            throw new HandleNotFoundException(handleId, offset);
        }
        for (int i = offset; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            Optional<DownloadReceipt> receipt = downloadClient.download(candidate);
            if (receipt.isPresent()) {
                log.info("download added handle={} offset={} title={}", handleId, i, candidate.getTitle());
                return new DownloadOutcome(true, candidate, i, receipt.get());
            }
            log.info("download failed handle={} offset={} title={}, trying next", handleId, i, candidate.getTitle());
        }
        log.warn("no release could be added handle={} from_offset={}", handleId, offset);
        return DownloadOutcome.failed(offset);
    }
}
