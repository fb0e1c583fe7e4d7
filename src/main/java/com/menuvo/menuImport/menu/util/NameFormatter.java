package com.menuvo.menuImport.menu.util;

import java.util.Locale;

/**
 * Utility class for normalizing the casing of extracted names.
 */
public class NameFormatter {

    private NameFormatter() {}

    /**
     * Trims and lower-cases the text, then upper-cases every letter at the start of the text or
     * directly after whitespace. Works on any Unicode letter ("über pizza" becomes "Über Pizza").
     *
     * @param text Text to format, may be null
     * @return Title-cased text, or an empty string for null
     */
    public static String toTitleCase(String text) {
        if (text == null) {
            return "";
        }
        return capitalizeWords(text.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Turns a snake_case object key into a category name ("hot_drinks" becomes "Hot Drinks").
     * Letters that are already upper case stay so ("BBQ_specials" becomes "BBQ Specials").
     */
    public static String keyToCategoryName(String key) {
        if (key == null) {
            return "";
        }
        return capitalizeWords(key.replace('_', ' ').strip());
    }

    private static String capitalizeWords(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean wordStart = true;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            if (wordStart && Character.isLetter(codePoint)) {
                result.appendCodePoint(Character.toTitleCase(codePoint));
            } else {
                result.appendCodePoint(codePoint);
            }
            wordStart = Character.isWhitespace(codePoint);
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }
}
