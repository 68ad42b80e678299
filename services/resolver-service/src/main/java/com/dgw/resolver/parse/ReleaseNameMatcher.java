package com.dgw.resolver.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ReleaseNameMatcher {
    private static final Pattern VIDEO = Pattern.compile(
        "\\.(YUV|WMV|WEBM|VOB|VIV|SVI|ROQ|RMVB|RM|OGV|OGG|NSV|MXF|MTS|M2TS|TS|MPG|MPEG|M2V|MP2|MPE|MPV|MP4|M4P"
            + "|M4V|MOV|QT|MNG|MKV|FLV|DRC|AVI|ASF|AMV)$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SUBTITLE = Pattern.compile("\\.(SRT|ASS|VTT|SUB|IDX|PGS)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAMPLE = Pattern.compile("sample", Pattern.CASE_INSENSITIVE);
    static final Pattern SEASON = Pattern.compile("(?:season|s)[.\\-_\\s]?(\\d+)", Pattern.CASE_INSENSITIVE);
    static final Pattern EPISODE = Pattern.compile("(?:episode|e)[.\\-_\\s]?(\\d+)", Pattern.CASE_INSENSITIVE);

    private ReleaseNameMatcher() {
    }

    public static boolean isVideo(String fileName) {
        if (fileName == null) {
            return false;
        }
        return VIDEO.matcher(fileName).find() && !SAMPLE.matcher(fileName).find();
    }

    public static boolean isSubtitle(String fileName) {
        return fileName != null && SUBTITLE.matcher(fileName).find();
    }

    public static Integer season(String text) {
        return firstNumber(SEASON, text);
    }

    public static Integer episode(String text) {
        return firstNumber(EPISODE, text);
    }

    public static String stripSeasonAndEpisode(String text) {
        if (text == null) {
            return "";
        }
        String stripped = SEASON.matcher(text).replaceAll("");
        stripped = EPISODE.matcher(stripped).replaceAll("");
        return stripped.trim().replaceAll("\\s{2,}", " ");
    }

    private static Integer firstNumber(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
