package com.dgw.resolver.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProfileRegistryTest {

    @Test
    void selectsByNameInRequestOrder() {
        ProfileRegistry registry = registry("classpath:profiles.yml", true);

        List<RankingProfile> selected = registry.select(List.of("small", "best", "small"));

        assertThat(selected).extracting(RankingProfile::getName).containsExactly("small", "best");
    }

    @Test
    void noNamesSelectsEveryProfile() {
        ProfileRegistry registry = registry("classpath:profiles.yml", true);

        assertThat(registry.select(List.of())).hasSameSizeAs(registry.all());
        assertThat(registry.select(null)).isNotEmpty();
    }

    @Test
    void unknownNameIsRejected() {
        ProfileRegistry registry = registry("classpath:profiles.yml", true);

        assertThatThrownBy(() -> registry.select(List.of("best", "nope")))
            .isInstanceOf(UnknownProfileException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void strictModeFailsOnMissingDocument() {
        assertThatThrownBy(() -> registry("classpath:missing-profiles.yml", true))
            .isInstanceOf(InvalidProfileException.class);
    }

    @Test
    void lenientModeStartsEmpty() {
        ProfileRegistry registry = registry("classpath:missing-profiles.yml", false);

        assertThat(registry.all()).isEmpty();
    }

    private static ProfileRegistry registry(String path, boolean strict) {
        ProfileProperties properties = new ProfileProperties();
        properties.setPath(path);
        properties.setStrict(strict);
        ProfileRegistry registry = new ProfileRegistry(new ProfileLoader(), properties);
        registry.init();
        return registry;
    }
}
