package io.github.eutro.qdebug.util;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * String helpers shared by the parsing stages.
 */
public class Strings {
    private Strings() {
    }

    /**
     * Check whether a string is non-empty and made up only of ASCII digits.
     *
     * @param text The string.
     * @return Whether the string is all digits.
     */
    @Contract(pure = true)
    public static boolean isDigits(String text) {
        if (text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    @Contract(pure = true)
    public static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    /**
     * Trim spaces, tabs and line breaks from both ends of a string.
     *
     * @param text The string.
     * @return The trimmed string.
     */
    @Contract(pure = true)
    @NotNull
    public static String trim(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isBlank(text.charAt(start))) start++;
        while (end > start && isBlank(text.charAt(end - 1))) end--;
        return text.substring(start, end);
    }

    @Contract(pure = true)
    @NotNull
    public static String removeWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Split a string on a delimiter.
     * <p>
     * Unlike {@link String#split(String)}, empty parts are always kept, including trailing ones,
     * so {@code split("", ',')} yields a single empty string.
     *
     * @param text      The string.
     * @param delimiter The delimiter.
     * @return The parts.
     */
    @Contract(pure = true)
    @NotNull
    public static List<String> split(String text, char delimiter) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = text.indexOf(delimiter, start)) != -1) {
            parts.add(text.substring(start, idx));
            start = idx + 1;
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * Split a string on runs of whitespace, discarding empty parts.
     *
     * @param text The string.
     * @return The tokens.
     */
    @Contract(pure = true)
    @NotNull
    public static List<String> tokens(String text) {
        List<String> parts = new ArrayList<>();
        int i = 0;
        int len = text.length();
        while (i < len) {
            while (i < len && Character.isWhitespace(text.charAt(i))) i++;
            int start = i;
            while (i < len && !Character.isWhitespace(text.charAt(i))) i++;
            if (i > start) parts.add(text.substring(start, i));
        }
        return parts;
    }

    /**
     * Count the occurrences of a character in a string.
     *
     * @param text The string.
     * @param c    The character.
     * @return The count.
     */
    @Contract(pure = true)
    public static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) n++;
        }
        return n;
    }
}
