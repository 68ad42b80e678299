package com.dgw.resolver.ledger;

import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.ResolutionHandle;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(LedgerProperties.class)
public class SelectionLedger {
    private final TtlCache<ResolutionHandle> handles;

    @Autowired
    public SelectionLedger(LedgerProperties properties) {
        this(new TtlCache<>(properties.getMaxEntries(), properties.getTtlMs()));
    }

    SelectionLedger(TtlCache<ResolutionHandle> handles) {
        this.handles = handles;
    }

    public ResolutionHandle put(List<Candidate> candidates) {
        while (true) {
            ResolutionHandle handle = new ResolutionHandle(UUID.randomUUID().toString(), candidates);
            if (handles.putIfAbsent(handle.id(), handle)) {
                return handle;
            }
        }
    }

    public Optional<ResolutionHandle> find(String handleId) {
        return handles.get(handleId);
    }

    public Optional<Candidate> get(String handleId, int offset) {
        return find(handleId)
            .filter(handle -> offset >= 0 && offset < handle.size())
            .map(handle -> handle.candidates().get(offset));
    }
}
