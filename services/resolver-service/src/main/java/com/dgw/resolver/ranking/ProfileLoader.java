package com.dgw.resolver.ranking;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

// rules are declared most important first and stored reversed, in application order
@Component
public class ProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final int DEFAULT_RESULTS = 5;

    public ProfileSet load(String path) {
        if (path != null && path.startsWith(CLASSPATH_PREFIX)) {
            String resource = path.substring(CLASSPATH_PREFIX.length());
            InputStream input = ProfileLoader.class.getClassLoader().getResourceAsStream(resource);
            if (input == null) {
                log.warn("profile document not found at {}", path);
                return new ProfileSet(List.of(), List.of("profile document not found: " + path));
            }
            try (InputStream in = input) {
                return parse(in);
            } catch (Exception ex) {
                log.warn("profile document load failed", ex);
                return new ProfileSet(List.of(), List.of("profile document unreadable: " + ex.getMessage()));
            }
        }
        Path resolved = Path.of(path == null ? "" : path);
        if (!Files.exists(resolved)) {
            log.warn("profile document not found at {}", path);
            return new ProfileSet(List.of(), List.of("profile document not found: " + path));
        }
        try (InputStream input = Files.newInputStream(resolved)) {
            return parse(input);
        } catch (Exception ex) {
            log.warn("profile document load failed", ex);
            return new ProfileSet(List.of(), List.of("profile document unreadable: " + ex.getMessage()));
        }
    }

    @SuppressWarnings("unchecked")
    public ProfileSet parse(InputStream input) {
        Object parsed = new Yaml().load(input);
        if (!(parsed instanceof Map<?, ?> root)) {
            return new ProfileSet(List.of(), List.of("root is not a map"));
        }
        Object rawProfiles = root.get("profiles");
        if (!(rawProfiles instanceof List<?> list)) {
            return new ProfileSet(List.of(), List.of("profiles list missing"));
        }
        List<RankingProfile> profiles = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof Map<?, ?> map)) {
                errors.add("profiles[" + i + "] is not a map");
                continue;
            }
            try {
                RankingProfile profile = parseProfile((Map<String, Object>) map);
                if (!names.add(profile.getName())) {
                    errors.add("duplicate profile: " + profile.getName());
                    continue;
                }
                profiles.add(profile);
            } catch (InvalidProfileException | IllegalArgumentException ex) {
                errors.add("profiles[" + i + "]: " + ex.getMessage());
            }
        }
        return new ProfileSet(profiles, errors);
    }

    RankingProfile parseProfile(Map<String, Object> map) {
        String name = asString(map.get("name"));
        if (name == null) {
            throw new InvalidProfileException("name required");
        }
        int results = asInt(map.get("results"), DEFAULT_RESULTS);

        List<ReleaseExpression> filters = new ArrayList<>();
        for (Object raw : asList(map.get("filters"), name + ".filters")) {
            filters.add(parseExpression(raw, name + ".filters"));
        }

        List<SortKey> declared = new ArrayList<>();
        for (Object raw : asList(map.get("rules"), name + ".rules")) {
            declared.add(new SortKey(parseExpression(raw, name + ".rules")));
        }
        List<SortKey> applied = new ArrayList<>(declared.size());
        for (int i = declared.size() - 1; i >= 0; i--) {
            applied.add(declared.get(i));
        }
        return new RankingProfile(name, results, filters, applied);
    }

    @SuppressWarnings("unchecked")
    ReleaseExpression parseExpression(Object raw, String where) {
        if (!(raw instanceof Map<?, ?> rawMap)) {
            throw new InvalidProfileException(where + ": expression must be a map");
        }
        Map<String, Object> map = (Map<String, Object>) rawMap;
        if (map.containsKey("all")) {
            return new ReleaseExpression.AllOf(parseTerms(map.get("all"), where + ".all"));
        }
        if (map.containsKey("any")) {
            return new ReleaseExpression.AnyOf(parseTerms(map.get("any"), where + ".any"));
        }
        if (map.containsKey("not")) {
            return new ReleaseExpression.Not(parseExpression(map.get("not"), where + ".not"));
        }
        String fieldKey = asString(map.get("field"));
        ReleaseField field = ReleaseField.fromKey(fieldKey);
        if (field == null) {
            throw new InvalidProfileException(where + ": unknown field " + fieldKey);
        }
        if (!map.containsKey("op")) {
            return new ReleaseExpression.FieldRef(field);
        }
        String operatorKey = asString(map.get("op"));
        Operator operator = Operator.fromKey(operatorKey);
        if (operator == null) {
            throw new InvalidProfileException(where + ": unknown operator " + operatorKey);
        }
        Object value = map.get("value");
        if (value == null) {
            throw new InvalidProfileException(where + ": value required for " + field.key() + " " + operator.key());
        }
        try {
            return ReleaseExpression.Comparison.of(field, operator, value);
        } catch (PatternSyntaxException ex) {
            throw new InvalidProfileException(where + ": invalid pattern " + value, ex);
        }
    }

    private List<ReleaseExpression> parseTerms(Object raw, String where) {
        List<ReleaseExpression> terms = new ArrayList<>();
        for (Object item : asList(raw, where)) {
            terms.add(parseExpression(item, where));
        }
        if (terms.isEmpty()) {
            throw new InvalidProfileException(where + ": at least one term required");
        }
        return terms;
    }

    private List<?> asList(Object raw, String where) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> list) {
            return list;
        }
        throw new InvalidProfileException(where + " must be a list");
    }

    private String asString(Object raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? null : value;
    }

    private int asInt(Object raw, int fallback) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                throw new InvalidProfileException("results must be a number: " + text, ex);
            }
        }
        return fallback;
    }
}
