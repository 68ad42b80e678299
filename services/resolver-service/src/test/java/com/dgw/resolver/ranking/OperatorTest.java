package com.dgw.resolver.ranking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class OperatorTest {

    @Test
    void numbersCompareAcrossTypes() {
        assertThat(Operator.EQ.test(1080, 1080.0, null)).isTrue();
        assertThat(Operator.GT.test(2.5, 2, null)).isTrue();
        assertThat(Operator.LTE.test(8, 8, null)).isTrue();
    }

    @Test
    void mismatchedTypesNeverCompare() {
        assertThat(Operator.GTE.test("abc", 3, null)).isFalse();
        assertThat(Operator.LT.test("abc", 3, null)).isFalse();
        assertThat(Operator.GT.test(null, 3, null)).isFalse();
    }

    @Test
    void containsChecksElementsOrSubstring() {
        assertThat(Operator.CONTAINS.test(List.of("EN", "DE"), "DE", null)).isTrue();
        assertThat(Operator.CONTAINS.test(List.of("EN"), "DE", null)).isFalse();
        assertThat(Operator.CONTAINS.test("Show.REMUX.mkv", "REMUX", null)).isTrue();
    }

    @Test
    void matchesUsesRegexFind() {
        assertThat(Operator.MATCHES.test("Movie.HDCAM.mkv", null, Pattern.compile("(?i)cam"))).isTrue();
        assertThat(Operator.MATCHES.test("Movie.WEB.mkv", null, Pattern.compile("(?i)cam"))).isFalse();
    }

    @Test
    void collectionsCompareBySize() {
        assertThat(Operator.GTE.test(List.of("EN", "DE"), 2, null)).isTrue();
    }
}
