package com.dgw.resolver.parse;

import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.RawRelease;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns search-result descriptors into candidates. Each attribute rule stands alone, so a descriptor
 * missing the size marker still yields resolution, seeders and so on.
 */
@Component
public class TitleParser {
    private static final Logger log = LoggerFactory.getLogger(TitleParser.class);

    static final String UNKNOWN_SOURCE = "unknown";

    private static final Pattern HASH = Pattern.compile("[0-9a-f]{40}");
    private static final Pattern RESOLUTION = Pattern.compile("(2160|1080|720|480)(?=[pi])", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIZE = Pattern.compile("💾\\s*(\\d+(?:[.,]\\d+)?)\\s*(GB|MB)");
    private static final Pattern SEEDERS = Pattern.compile("👤\\s*(\\d+)");
    private static final Pattern SOURCE = Pattern.compile("⚙️?\\s*(.*)$", Pattern.MULTILINE);

    public List<Candidate> parseAll(List<RawRelease> entries) {
        List<Candidate> candidates = new ArrayList<>();
        if (entries == null) {
            return candidates;
        }
        Set<String> seen = new LinkedHashSet<>();
        int skipped = 0;
        for (RawRelease entry : entries) {
            Optional<Candidate> parsed = parse(entry);
            if (parsed.isEmpty()) {
                skipped++;
                continue;
            }
            if (seen.add(parsed.get().getHash())) {
                candidates.add(parsed.get());
            }
        }
        if (skipped > 0) {
            log.debug("skipped malformed entries count={}", skipped);
        }
        return candidates;
    }

    public Optional<Candidate> parse(RawRelease entry) {
        if (entry == null || entry.title() == null || entry.title().isBlank() || entry.infoHash() == null) {
            return Optional.empty();
        }
        String hash = entry.infoHash().trim().toLowerCase(Locale.ROOT);
        if (!HASH.matcher(hash).matches()) {
            log.debug("skipping entry with malformed hash={}", entry.infoHash());
            return Optional.empty();
        }
        try {
            String descriptor = entry.title();
            Candidate candidate = new Candidate();
            candidate.setTitle(descriptor.split("\n", 2)[0].trim().replace(' ', '.'));
            candidate.setLanguages(LanguageFlags.languagesOf(descriptor));
            candidate.setResolution(resolutionOf(descriptor));
            candidate.setSizeGb(sizeGbOf(descriptor));
            candidate.setSeeders(seedersOf(descriptor));
            candidate.setSource(sourceOf(descriptor));
            candidate.setHash(hash);
            candidate.setMagnet("magnet:?xt=urn:btih:" + hash + "&dn=&tr=");
            return Optional.of(candidate);
        } catch (RuntimeException ex) {
            log.debug("skipping unparseable entry hash={}", hash, ex);
            return Optional.empty();
        }
    }

    static int resolutionOf(String descriptor) {
        Matcher matcher = RESOLUTION.matcher(descriptor);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    static double sizeGbOf(String descriptor) {
        Matcher matcher = SIZE.matcher(descriptor);
        if (!matcher.find()) {
            return 0.0;
        }
        double value = Double.parseDouble(matcher.group(1).replace(',', '.'));
        return "MB".equals(matcher.group(2)) ? value / 1000.0 : value;
    }

    static int seedersOf(String descriptor) {
        Matcher matcher = SEEDERS.matcher(descriptor);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            // digits only, so the count overflowed
            return Integer.MAX_VALUE;
        }
    }

    static String sourceOf(String descriptor) {
        Matcher matcher = SOURCE.matcher(descriptor);
        if (!matcher.find()) {
            return UNKNOWN_SOURCE;
        }
        String source = matcher.group(1).trim();
        return source.isEmpty() ? UNKNOWN_SOURCE : source;
    }
}
