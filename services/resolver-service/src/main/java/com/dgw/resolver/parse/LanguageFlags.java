package com.dgw.resolver.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LanguageFlags {
    private static final int REGIONAL_INDICATOR_A = 0x1F1E6;
    private static final Pattern FLAG = Pattern.compile("[\\x{1F1E6}-\\x{1F1FF}][\\x{1F1E6}-\\x{1F1FF}]");

    // country code -> language code
    private static final String[] TABLE = {
        "AD", "CA", "AF", "PS", "AG", "EN", "AI", "EN", "AL", "SQ", "AM", "HY", "AO", "PT", "AQ", "EN",
        "AR", "ES", "AS", "EN", "AT", "DE", "AU", "EN", "AW", "NL", "AZ", "AZ", "BA", "BS", "BB", "EN",
        "BD", "BN", "BE", "NL", "BF", "FR", "BG", "BG", "BH", "AR", "BI", "RN", "BJ", "FR", "BM", "EN",
        "BN", "MS", "BO", "ES", "BQ", "NL", "BR", "PT", "BS", "EN", "BT", "DZ", "BW", "EN", "BY", "BE",
        "BZ", "EN", "CA", "EN", "CC", "EN", "CD", "FR", "CF", "FR", "CG", "FR", "CK", "EN", "CL", "ES",
        "CM", "FR", "CN", "ZH", "CO", "ES", "CR", "ES", "CU", "ES", "CV", "PT", "CW", "NL", "CX", "EN",
        "CY", "EL", "CZ", "CS", "DE", "DE", "DJ", "FR", "DK", "DA", "DM", "EN", "DO", "ES", "DZ", "AR",
        "EC", "ES", "EE", "ET", "EG", "AR", "ER", "TI", "ES", "ES", "ET", "AM", "FI", "FI", "FJ", "EN",
        "FK", "EN", "FO", "FO", "FR", "FR", "GA", "FR", "GB", "EN", "GD", "EN", "GE", "KA", "GF", "FR",
        "GG", "EN", "GH", "EN", "GI", "EN", "GL", "KL", "GM", "EN", "GN", "FR", "GP", "FR", "GQ", "ES",
        "GR", "EL", "GT", "ES", "GU", "EN", "GW", "PT", "GY", "EN", "HK", "ZH", "HM", "EN", "HN", "ES",
        "HR", "HR", "HT", "FR", "HU", "HU", "IC", "ES", "ID", "ID", "IE", "EN", "IL", "HE", "IM", "EN",
        "IN", "HI", "IO", "EN", "IQ", "AR", "IR", "FA", "IS", "IS", "IT", "IT", "JE", "EN", "JM", "EN",
        "JO", "AR", "JP", "JA", "KE", "SW", "KG", "KY", "KH", "KM", "KI", "EN", "KM", "AR", "KR", "KO",
        "KW", "AR", "KY", "EN", "KZ", "KK", "LA", "LO", "LB", "AR", "LI", "DE", "LR", "EN", "LS", "EN",
        "LT", "LT", "LU", "FR", "LV", "LV", "LY", "AR", "MA", "AR", "MG", "FR", "MM", "MY", "MO", "ZH",
        "MV", "DV", "MW", "EN", "MX", "ES", "MY", "MS", "NG", "EN", "NP", "NE", "NZ", "EN", "OM", "AR",
        "PE", "ES", "PF", "FR", "PH", "TL", "PK", "UR", "PL", "PL", "PT", "PT", "RU", "RU", "SA", "AR",
        "SE", "SE", "SG", "EN", "SV", "ES", "SZ", "EN", "TD", "AR", "TF", "FR", "TH", "TH", "TR", "TR",
        "UA", "UK", "VE", "ES", "VG", "EN", "VN", "VI", "XK", "SQ", "ZA", "ZU",
    };

    private static final Map<String, String> FLAG_TO_LANGUAGE = buildTable();

    private LanguageFlags() {
    }

    public static List<String> languagesOf(String text) {
        List<String> languages = new ArrayList<>();
        if (text != null) {
            Matcher matcher = FLAG.matcher(text);
            while (matcher.find()) {
                String flag = matcher.group();
                languages.add(FLAG_TO_LANGUAGE.getOrDefault(flag, flag));
            }
        }
        if (languages.isEmpty()) {
            languages.add("EN");
        }
        return languages;
    }

    public static String flagOf(String countryCode) {
        StringBuilder flag = new StringBuilder();
        for (char letter : countryCode.toCharArray()) {
            flag.appendCodePoint(REGIONAL_INDICATOR_A + (letter - 'A'));
        }
        return flag.toString();
    }

    private static Map<String, String> buildTable() {
        Map<String, String> table = new HashMap<>();
        for (int i = 0; i + 1 < TABLE.length; i += 2) {
            table.put(flagOf(TABLE[i]), TABLE[i + 1]);
        }
        return Collections.unmodifiableMap(table);
    }
}
