package com.dgw.resolver.debrid;

import java.util.List;
import java.util.Map;

public interface CacheLookup {

    String providerCode();

    Map<String, List<Map<String, CachedFile>>> checkAvailability(List<String> hashes);
}
