package com.dgw.resolver.debrid;

import com.dgw.resolver.model.Candidate;
import java.util.Optional;

public interface DownloadClient {

    Optional<DownloadReceipt> download(Candidate candidate);
}
