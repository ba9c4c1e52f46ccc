package com.olympicsdata.domain.service;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text normalization shared by the readers and the reconciler.
 */
public final class NormalizationUtils {

    private NormalizationUtils() {
    }

    /**
     * Normalizes text into a match key.
     *
     * Rules:
     * 1. Remove accents (Côte -> COTE)
     * 2. Convert to uppercase
     * 3. Replace non-alphanumeric runs with a single underscore
     * 4. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toUpperCase(Locale.ROOT);
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Display form: trimmed, inner whitespace collapsed, casing untouched.
     */
    public static String displayText(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest.
     * A word starts after any non-letter, so "O'BRIEN-SMITH" becomes "O'Brien-Smith".
     */
    public static String titleCase(String text) {
        String display = displayText(text);
        StringBuilder sb = new StringBuilder(display.length());
        boolean previousLetter = false;
        for (int i = 0; i < display.length(); i++) {
            char c = display.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }

    /**
     * Turns "SURNAME Given Names" into "Given Names SURNAME". Single words are returned as is.
     */
    public static String reverseName(String name) {
        String[] parts = displayText(name).split(" ");
        if (parts.length < 2) {
            return displayText(name);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < parts.length; i++) {
            sb.append(parts[i]).append(' ');
        }
        return sb.append(parts[0]).toString();
    }

    /**
     * Parses a list literal cell such as {@code "['Cycling Road', \"Women's Keirin\"]"}.
     * Quoted items may contain commas and the other quote character; unquoted items end at a comma.
     * Anything that is not a bracketed list yields an empty list.
     */
    public static List<String> parseListField(String cell) {
        List<String> result = new ArrayList<>();
        if (cell == null) {
            return result;
        }
        String s = cell.trim();
        if (s.length() >= 2 && (s.startsWith("\"") && s.endsWith("\"") || s.startsWith("'") && s.endsWith("'"))) {
            s = s.substring(1, s.length() - 1).trim();
        }
        if (!s.startsWith("[") || !s.endsWith("]")) {
            return result;
        }
        String content = s.substring(1, s.length() - 1).trim();
        int i = 0;
        int n = content.length();
        while (i < n) {
            while (i < n && (content.charAt(i) == ' ' || content.charAt(i) == ',')) {
                i++;
            }
            if (i >= n) {
                break;
            }
            char c = content.charAt(i);
            if (c == '"' || c == '\'') {
                int end = content.indexOf(c, i + 1);
                if (end < 0) {
                    end = n;
                }
                result.add(content.substring(i + 1, end));
                i = end + 1;
            } else {
                int end = content.indexOf(',', i);
                if (end < 0) {
                    end = n;
                }
                String item = content.substring(i, end).trim();
                if (!item.isEmpty()) {
                    result.add(item);
                }
                i = end;
            }
        }
        return result;
    }
}
