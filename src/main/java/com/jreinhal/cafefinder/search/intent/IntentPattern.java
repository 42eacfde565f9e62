package com.jreinhal.cafefinder.search.intent;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One trigger of an intent definition.
 *
 * <ul>
 *   <li>{@code PHRASE}: substring of the normalized query</li>
 *   <li>{@code KEYWORD}: member of the normalized token set</li>
 *   <li>{@code REGEX}: found anywhere in the normalized query</li>
 * </ul>
 */
public final class IntentPattern {

    public enum Kind {
        PHRASE,
        KEYWORD,
        REGEX
    }

    private final Kind kind;
    private final String value;
    private final Pattern regex;

    private IntentPattern(Kind kind, String value, Pattern regex) {
        this.kind = kind;
        this.value = value;
        this.regex = regex;
    }

    public static IntentPattern phrase(String phrase) {
        return new IntentPattern(Kind.PHRASE, phrase.toLowerCase(Locale.ROOT), null);
    }

    public static IntentPattern keyword(String keyword) {
        return new IntentPattern(Kind.KEYWORD, keyword.toLowerCase(Locale.ROOT), null);
    }

    public static IntentPattern regex(String regex) {
        return new IntentPattern(Kind.REGEX, regex, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean matches(String normalizedQuery, Set<String> tokenSet) {
        return switch (this.kind) {
            case PHRASE -> normalizedQuery.contains(this.value);
            case KEYWORD -> tokenSet.contains(this.value);
            case REGEX -> this.regex.matcher(normalizedQuery).find();
        };
    }

    public Kind kind() {
        return this.kind;
    }

    public String value() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.kind + ":" + this.value;
    }
}
