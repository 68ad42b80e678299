package com.dgw.resolver.catalog;

import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.parse.ReleaseNameMatcher;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class QueryIdentifier {
    private static final Logger log = LoggerFactory.getLogger(QueryIdentifier.class);
    private static final Pattern IMDB_ID = Pattern.compile("tt\\d+", Pattern.CASE_INSENSITIVE);

    private final CinemetaGateway cinemetaGateway;

    public QueryIdentifier(CinemetaGateway cinemetaGateway) {
        this.cinemetaGateway = cinemetaGateway;
    }

    public Optional<MediaTarget> identify(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        Integer season = ReleaseNameMatcher.season(query);
        Integer episode = ReleaseNameMatcher.episode(query);
        MediaKind kind = season != null ? MediaKind.SHOW : null;

        Matcher imdb = IMDB_ID.matcher(query);
        if (imdb.find()) {
            String externalId = imdb.group().toLowerCase(Locale.ROOT);
            return Optional.of(target(kind == null ? MediaKind.MOVIE : kind, externalId, season, episode));
        }

        String title = ReleaseNameMatcher.stripSeasonAndEpisode(query);
        if (title.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> externalId;
        if (kind == MediaKind.SHOW) {
            externalId = cinemetaGateway.findImdbId(MediaKind.SHOW, title);
        } else {
            kind = MediaKind.MOVIE;
            externalId = cinemetaGateway.findImdbId(MediaKind.MOVIE, title);
            if (externalId.isEmpty()) {
                kind = MediaKind.SHOW;
                externalId = cinemetaGateway.findImdbId(MediaKind.SHOW, title);
            }
        }
        if (externalId.isEmpty()) {
            log.info("query not identified query={}", query);
            return Optional.empty();
        }
        MediaTarget target = target(kind, externalId.get(), season, episode);
        log.info("query identified query={} target={}", query, target.slotKey());
        return Optional.of(target);
    }

    private MediaTarget target(MediaKind kind, String externalId, Integer season, Integer episode) {
        if (kind == MediaKind.MOVIE) {
            return MediaTarget.movie(externalId);
        }
        return MediaTarget.show(externalId, List.of(season == null ? 1 : season), episode);
    }
}
