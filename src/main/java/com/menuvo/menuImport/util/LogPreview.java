package com.menuvo.menuImport.util;

/**
 * Utility class for bounding untrusted text before it is written to logs.
 */
public class LogPreview {

    public static final int DEFAULT_LENGTH = 200;

    private LogPreview() {}

    /**
     * First {@value #DEFAULT_LENGTH} characters of the text, with an ellipsis when cut.
     */
    public static String of(String text) {
        return of(text, DEFAULT_LENGTH);
    }

    public static String of(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
