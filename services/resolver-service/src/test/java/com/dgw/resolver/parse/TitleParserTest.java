package com.dgw.resolver.parse;

import static org.assertj.core.api.Assertions.assertThat;

import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.RawRelease;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TitleParserTest {
    private static final String HASH_A = "a".repeat(40);
    private static final String HASH_B = "b".repeat(40);

    private final TitleParser parser = new TitleParser();

    @Test
    void parsesEveryAttributeFromDescriptor() {
        String descriptor = "Movie Name 2019 2160p WEB-DL\n"
            + "👤 42 💾 1.5 GB ⚙️ ThePirateBay\n"
            + LanguageFlags.flagOf("DE") + " / " + LanguageFlags.flagOf("FR");

        Candidate candidate = parser.parse(new RawRelease(descriptor, HASH_A.toUpperCase())).orElseThrow();

        assertThat(candidate.getTitle()).isEqualTo("Movie.Name.2019.2160p.WEB-DL");
        assertThat(candidate.getResolution()).isEqualTo(2160);
        assertThat(candidate.getSizeGb()).isEqualTo(1.5);
        assertThat(candidate.getSeeders()).isEqualTo(42);
        assertThat(candidate.getLanguages()).containsExactly("DE", "FR");
        assertThat(candidate.getHash()).isEqualTo(HASH_A);
        assertThat(candidate.getMagnet()).isEqualTo("magnet:?xt=urn:btih:" + HASH_A + "&dn=&tr=");
    }

    @Test
    void oversizedSeederCountDoesNotDropEntry() {
        Candidate candidate = parser.parse(new RawRelease("Movie 1080p\n👤 99999999999 💾 2 GB ⚙️ X", HASH_A))
            .orElseThrow();

        assertThat(candidate.getSeeders()).isEqualTo(Integer.MAX_VALUE);
        assertThat(candidate.getResolution()).isEqualTo(1080);
        assertThat(candidate.getSizeGb()).isEqualTo(2.0);
    }

    @Test
    void missingMarkersFallBackToDefaults() {
        Candidate candidate = parser.parse(new RawRelease("Some.Release.x264", HASH_A)).orElseThrow();

        assertThat(candidate.getResolution()).isZero();
        assertThat(candidate.getSizeGb()).isZero();
        assertThat(candidate.getSeeders()).isZero();
        assertThat(candidate.getLanguages()).containsExactly("EN");
        assertThat(candidate.getSource()).isEqualTo(TitleParser.UNKNOWN_SOURCE);
    }

    @Test
    void megabytesAreConvertedToGigabytes() {
        assertThat(TitleParser.sizeGbOf("💾 500 MB")).isEqualTo(0.5);
        assertThat(TitleParser.sizeGbOf("💾 2,5 GB")).isEqualTo(2.5);
    }

    @Test
    void resolutionNeedsProgressiveOrInterlacedSuffix() {
        assertThat(TitleParser.resolutionOf("Show.1080i.HDTV")).isEqualTo(1080);
        assertThat(TitleParser.resolutionOf("Show.720P.WEB")).isEqualTo(720);
        assertThat(TitleParser.resolutionOf("Show.1080.WEB")).isZero();
    }

    @Test
    void sourceIsTextAfterGearMarker() {
        assertThat(TitleParser.sourceOf("Title\n👤 3 💾 1 GB ⚙️ RARBG")).isEqualTo("RARBG");
    }

    @Test
    void malformedEntriesAreSkipped() {
        assertThat(parser.parse(new RawRelease("Title 1080p", "not-a-hash"))).isEqualTo(Optional.empty());
        assertThat(parser.parse(new RawRelease(null, HASH_A))).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void parseAllKeepsFirstEntryPerHash() {
        List<Candidate> parsed = parser.parseAll(List.of(
            new RawRelease("First 1080p", HASH_A),
            new RawRelease("Broken", "xyz"),
            new RawRelease("Second 720p", HASH_B),
            new RawRelease("Duplicate 2160p", HASH_A.toUpperCase())
        ));

        assertThat(parsed).extracting(Candidate::getTitle).containsExactly("First.1080p", "Second.720p");
        assertThat(parsed.get(0).getResolution()).isEqualTo(1080);
    }
}
