package com.dgw.resolver.common;

import com.dgw.resolver.model.Candidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ReleaseTable {
    private ReleaseTable() {
    }

    public static List<String> render(List<Candidate> candidates) {
        int indexWidth = String.valueOf(candidates.size()).length();
        int resolutionWidth = 0;
        int languageWidth = 0;
        int titleWidth = 0;
        int sizeWidth = 0;
        int cachedWidth = 0;
        int seederWidth = 0;
        for (Candidate candidate : candidates) {
            resolutionWidth = Math.max(resolutionWidth, String.valueOf(candidate.getResolution()).length());
            languageWidth = Math.max(languageWidth, String.join("/", candidate.getLanguages()).length());
            titleWidth = Math.max(titleWidth, String.valueOf(candidate.getTitle()).length());
            sizeWidth = Math.max(sizeWidth, size(candidate).length());
            cachedWidth = Math.max(cachedWidth, String.join("/", candidate.getCached()).length());
            seederWidth = Math.max(seederWidth, String.valueOf(candidate.getSeeders()).length());
        }
        List<String> lines = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            lines.add(pad((i + 1) + ")", indexWidth + 1)
                + " resolution: " + pad(String.valueOf(candidate.getResolution()), resolutionWidth)
                + " | languages: " + pad(String.join("/", candidate.getLanguages()), languageWidth)
                + " | title: " + pad(String.valueOf(candidate.getTitle()), titleWidth)
                + " | size: " + pad(size(candidate), sizeWidth)
                + " | cached: " + pad(String.join("/", candidate.getCached()), cachedWidth)
                + " | seeders: " + pad(String.valueOf(candidate.getSeeders()), seederWidth)
                + " | source: " + candidate.getSource());
        }
        return lines;
    }

    private static String size(Candidate candidate) {
        return String.format(Locale.ROOT, "%.2f", candidate.getSizeGb());
    }

    private static String pad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return value + " ".repeat(width - value.length());
    }
}
