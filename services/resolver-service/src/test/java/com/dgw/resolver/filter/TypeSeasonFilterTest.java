package com.dgw.resolver.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.FileEntry;
import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.Version;
import com.dgw.resolver.parse.ReleaseNameMatcher;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeSeasonFilterTest {
    private final TypeSeasonFilter filter = new TypeSeasonFilter();

    @Test
    void movieNeedsAtLeastOneVideo() {
        Candidate empty = candidate("empty", version("readme.txt"));
        Candidate movie = candidate("movie", version("Movie.2019.1080p.mkv"));

        List<Candidate> kept = filter.apply(List.of(empty, movie), MediaTarget.movie("tt1"));

        assertThat(kept).extracting(Candidate::getTitle).containsExactly("movie");
        assertThat(kept.get(0).getKind()).isEqualTo(MediaKind.MOVIE);
    }

    @Test
    void episodeRequestNeedsExactlyOneEpisode() {
        Candidate single = candidate("single", version("Show.S02E05.mkv"));
        Candidate pack = candidate("pack", version("Show.S02E04.mkv", "Show.S02E05.mkv", "Show.S02E06.mkv"));

        List<Candidate> kept = filter.apply(List.of(single, pack), MediaTarget.show("tt2", List.of(2), 5));

        assertThat(kept).extracting(Candidate::getTitle).containsExactly("single");
        assertThat(kept.get(0).getKind()).isEqualTo(MediaKind.SHOW);
    }

    @Test
    void seasonRequestNeedsSeveralEpisodesOfThatSeason() {
        Candidate seasonPack = candidate("pack", version("Show.S01E01.mkv", "Show.S01E02.mkv"));
        Candidate wrongSeason = candidate("wrong", version("Show.S02E01.mkv", "Show.S02E02.mkv"));
        Candidate oneEpisode = candidate("one", version("Show.S01E01.mkv"));

        List<Candidate> kept = filter.apply(List.of(seasonPack, wrongSeason, oneEpisode),
            MediaTarget.show("tt3", List.of(1), null));

        assertThat(kept).extracting(Candidate::getTitle).containsExactly("pack");
    }

    @Test
    void multiSeasonRequestToleratesUpToHalfMissing() {
        Candidate firstOnly = candidate("first", version("Show.S01E01.mkv", "Show.S01E02.mkv"));
        Candidate firstTwo = candidate("two", version(
            "Show.S01E01.mkv", "Show.S01E02.mkv", "Show.S02E01.mkv", "Show.S02E02.mkv"));

        List<Candidate> kept = filter.apply(List.of(firstOnly, firstTwo),
            MediaTarget.show("tt4", List.of(1, 2, 3), null));

        assertThat(kept).extracting(Candidate::getTitle).containsExactly("two");
    }

    @Test
    void versionsFailingTheRuleArePruned() {
        Version good = version("Show.S01E01.mkv", "Show.S01E02.mkv");
        Version bad = version("Show.S01E01.mkv");
        Candidate candidate = candidate("mixed", good, bad);

        List<Candidate> kept = filter.apply(List.of(candidate), MediaTarget.show("tt5", List.of(1), null));

        assertThat(kept).hasSize(1);
        assertThat(kept.get(0).getVersions()).containsExactly(good);
    }

    private static Candidate candidate(String title, Version... versions) {
        Candidate candidate = new Candidate();
        candidate.setTitle(title);
        candidate.setHash(title);
        candidate.setVersions(List.of(versions));
        candidate.promote(versions[0]);
        return candidate;
    }

    private static Version version(String... names) {
        List<FileEntry> files = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            String name = names[i];
            files.add(new FileEntry(name, 1.0, String.valueOf(i + 1), ReleaseNameMatcher.isVideo(name),
                ReleaseNameMatcher.isSubtitle(name), ReleaseNameMatcher.season(name), ReleaseNameMatcher.episode(name)));
        }
        return new Version(files);
    }
}
