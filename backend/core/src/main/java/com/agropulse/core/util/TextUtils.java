package com.agropulse.core.util;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{Alnum}]+");

    private TextUtils() {
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static boolean isBlank(String text) {
        return text == null || collapseWhitespace(text).isEmpty();
    }

    public static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    public static boolean containsAny(String haystack, Collection<String> needles) {
        String lowered = lower(haystack);
        for (String needle : needles) {
            if (!needle.isEmpty() && lowered.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    public static String identityForm(String text) {
        String decomposed = Normalizer.normalize(collapseWhitespace(text), Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return NON_ALNUM.matcher(lower(stripped)).replaceAll(" ").trim();
    }
}
