package com.dgw.resolver.ranking;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(ProfileProperties.class)
public class ProfileRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProfileRegistry.class);

    private final ProfileLoader loader;
    private final ProfileProperties properties;
    private volatile Map<String, RankingProfile> profiles = Map.of();

    public ProfileRegistry(ProfileLoader loader, ProfileProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ProfileSet loaded = loader.load(properties.getPath());
        if (!loaded.isValid()) {
            String problems = loaded.errors().isEmpty() ? "no profiles defined" : String.join("; ", loaded.errors());
            if (properties.isStrict()) {
                throw new InvalidProfileException("ranking profiles invalid: " + problems);
            }
            log.warn("ranking profiles invalid, keeping {} valid: {}", loaded.profiles().size(), problems);
        }
        Map<String, RankingProfile> byName = new LinkedHashMap<>();
        for (RankingProfile profile : loaded.profiles()) {
            byName.put(profile.getName(), profile);
        }
        profiles = byName;
        log.info("ranking profiles loaded path={} names={}", properties.getPath(), byName.keySet());
    }

    public List<RankingProfile> select(Collection<String> names) {
        Map<String, RankingProfile> current = profiles;
        if (names == null || names.isEmpty()) {
            return new ArrayList<>(current.values());
        }
        List<RankingProfile> selected = new ArrayList<>(names.size());
        for (String name : names) {
            RankingProfile profile = current.get(name);
            if (profile == null) {
                throw new UnknownProfileException(name);
            }
            if (!selected.contains(profile)) {
                selected.add(profile);
            }
        }
        return selected;
    }

    public Collection<RankingProfile> all() {
        return profiles.values();
    }
}
