package com.launcher.linkbase.locale;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Language, country and modifier taken from a POSIX locale specifier
 * ({@code language[_COUNTRY][.charset][@modifier]}).
 *
 * Used to pick localized keys such as {@code Name[de_DE]} out of desktop entries.
 */
@Value
@AllArgsConstructor
public class LocaleSelector {

    private static final List<String> LOCALE_VARIABLES = List.of("LC_ALL", "LC_MESSAGES", "LANG");

    /** Leading letter run, empty when the specifier does not start with one. */
    String language;

    /** Letter run after {@code _}, or null. */
    String country;

    /** Letter run after {@code @}, or null. Only parsed once a country is present. */
    String modifier;

    /**
     * Parse a locale specifier. Each segment is a run of ASCII letters; a
     * character that is neither a letter nor the delimiter expected next ends
     * parsing and leaves the later segments unset.
     */
    public static LocaleSelector parse(String specifier) {
        String s = (specifier == null) ? "" : specifier;
        int n = s.length();

        String language = null;
        String country = null;
        String modifier = null;

        int i = scanLetters(s, 0);
        if (i == n || isOneOf(s.charAt(i), "_.@")) {
            language = s.substring(0, i);
        }

        if (language != null && i < n && s.charAt(i) == '_') {
            int start = i + 1;
            i = scanLetters(s, start);
            if (i == n || isOneOf(s.charAt(i), ".@")) {
                country = s.substring(start, i);
            }
        }

        // The charset segment is ignored, whatever characters it contains
        if (country != null && i < n && s.charAt(i) == '.') {
            while (i < n && s.charAt(i) != '@') {
                i++;
            }
        }

        if (country != null && i < n && s.charAt(i) == '@') {
            int start = i + 1;
            i = scanLetters(s, start);
            if (i == n) {
                modifier = s.substring(start, i);
            }
        }

        return new LocaleSelector(language == null ? "" : language, country, modifier);
    }

    /**
     * Resolve the locale for messages the way POSIX does: {@code LC_ALL},
     * then {@code LC_MESSAGES}, then {@code LANG}, then {@code C}.
     */
    public static LocaleSelector fromEnvironment(Map<String, String> env) {
        for (String variable : LOCALE_VARIABLES) {
            String value = env.get(variable);
            if (value != null && !value.isBlank()) {
                return parse(value);
            }
        }
        return parse("C");
    }

    public boolean hasCountry() {
        return country != null;
    }

    public boolean hasModifier() {
        return modifier != null;
    }

    /**
     * Locale suffixes for localized keys, most specific first:
     * {@code lang_COUNTRY@MODIFIER}, {@code lang_COUNTRY}, {@code lang@MODIFIER}, {@code lang}.
     */
    public List<String> candidateKeys() {
        List<String> keys = new ArrayList<>();
        if (language.isEmpty()) {
            return keys;
        }
        if (hasCountry() && hasModifier()) {
            keys.add(language + "_" + country + "@" + modifier);
        }
        if (hasCountry()) {
            keys.add(language + "_" + country);
        }
        if (hasModifier()) {
            keys.add(language + "@" + modifier);
        }
        keys.add(language);
        return keys;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(language);
        if (country != null) sb.append('_').append(country);
        if (modifier != null) sb.append('@').append(modifier);
        return sb.toString();
    }

    private static int scanLetters(String s, int from) {
        int i = from;
        while (i < s.length() && isAsciiLetter(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isOneOf(char c, String chars) {
        return chars.indexOf(c) >= 0;
    }
}
