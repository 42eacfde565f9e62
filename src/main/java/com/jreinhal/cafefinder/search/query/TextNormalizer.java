package com.jreinhal.cafefinder.search.query;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lowercasing, diacritic folding and tokenization shared by the query pipeline and the indexes.
 */
public final class TextNormalizer {
    private static final Pattern DIACRITICS = Pattern.compile("[\\u0300-\\u036f]");
    private static final Pattern NON_TOKEN_CHARS = Pattern.compile("[^a-z0-9-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,;!?()\\[\\]{}'\"]+");

    private TextNormalizer() {
    }

    public static String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }
        String folded = fold(query.toLowerCase(Locale.ROOT).trim());
        return WHITESPACE.matcher(folded).replaceAll(" ");
    }

    /**
     * Lowercased, diacritic-free token reduced to {@code [a-z0-9-]}; may be empty.
     */
    public static String normalizeToken(String token) {
        if (token == null) {
            return "";
        }
        String folded = fold(token.toLowerCase(Locale.ROOT).trim());
        return NON_TOKEN_CHARS.matcher(folded).replaceAll("");
    }

    /**
     * Single words go through {@link #normalizeToken}; multi-word phrases keep their inner spaces.
     */
    public static String normalizeTerm(String term) {
        if (term == null) {
            return "";
        }
        return WHITESPACE.matcher(term.trim()).find() ? normalizeQuery(term) : normalizeToken(term);
    }

    /**
     * Lowercases and strips diacritics char by char so offsets into the result match offsets
     * into {@code text}. A char whose decomposition does not reduce to one base char is only
     * lowercased.
     */
    public static String foldPreservingOffsets(String text) {
        if (text == null) {
            return "";
        }
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = Character.toLowerCase(chars[i]);
            if (c >= 0x80 && !Character.isSurrogate(c)) {
                String base = fold(String.valueOf(c));
                if (base.length() == 1) {
                    c = base.charAt(0);
                }
            }
            chars[i] = c;
        }
        return new String(chars);
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(TOKEN_SEPARATORS.split(text))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    public static String collapseWhitespace(String text) {
        return text == null ? "" : WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    private static String fold(String value) {
        return DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
    }
}
