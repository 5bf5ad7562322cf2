package com.gt.tutor.util;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collapses inconsistently spelled item identifiers into one canonical key.
 * <p>
 * Examples: {@code -아요/-어요}, {@code -아요-어요} and {@code -아요어요} all become {@code -아요_어요};
 * {@code 은/는} and {@code 은는} both become {@code 은_는}. Hangul and other non-Latin letters are kept,
 * Latin letters are lowercased, punctuation other than {@code _} and {@code -} is dropped.
 * <p>
 * The rules are applied until the value stops changing, so {@code normalize(normalize(x)) == normalize(x)}.
 */
public class IdentifierNormalizer {

    private static final int MAX_PASSES = 8;

    // Separator between two Hangul syllables: "요/어", "요/-어", "요-어", "요--어"
    private static final Pattern HANGUL_SEPARATOR = Pattern.compile("(?<=[가-힣])(?:/-?|--?)(?=[가-힣])");
    private static final Pattern UNDERSCORE_HYPHEN_BEFORE_HANGUL = Pattern.compile("_-(?=[가-힣])");
    private static final Pattern DISALLOWED_CHARACTERS = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s\\p{Z}_\\-]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");

    // Pattern pairs commonly written without any separator
    private static final Map<String, String> MASHED_PAIRS = new LinkedHashMap<>();
    static {
        MASHED_PAIRS.put("이에요예요", "이에요_예요");
        MASHED_PAIRS.put("아요어요", "아요_어요");
        MASHED_PAIRS.put("은는", "은_는");
        MASHED_PAIRS.put("이가", "이_가");
        MASHED_PAIRS.put("을를", "을_를");
    }

    public static String normalize(String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return "";
        }

        String current = rawId;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = normalizeOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }

        return current;
    }

    static String normalizeOnce(String value) {
        String s = Normalizer.normalize(value, Normalizer.Form.NFC).strip();

        s = HANGUL_SEPARATOR.matcher(s).replaceAll("_");
        for (Map.Entry<String, String> mashedPair : MASHED_PAIRS.entrySet()) {
            s = s.replace(mashedPair.getKey(), mashedPair.getValue());
        }
        s = UNDERSCORE_HYPHEN_BEFORE_HANGUL.matcher(s).replaceAll("_");

        s = s.toLowerCase(Locale.ROOT);
        s = DISALLOWED_CHARACTERS.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll("_");
        s = REPEATED_UNDERSCORES.matcher(s).replaceAll("_");

        return stripUnderscores(s);
    }

    private static String stripUnderscores(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '_') {
            end--;
        }
        return s.substring(start, end);
    }
}
