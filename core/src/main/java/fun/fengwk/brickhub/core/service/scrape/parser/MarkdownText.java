package fun.fengwk.brickhub.core.service.scrape.parser;

import java.util.regex.Pattern;

/**
 * Unicode aware whitespace helpers shared by the renderer and the inventory extractor.
 *
 * @author fengwk
 */
public final class MarkdownText {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("(?U)\\s+");

    private MarkdownText() {
    }

    public static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    public static String trim(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && isWhitespace(value.codePointAt(start))) {
            start += Character.charCount(value.codePointAt(start));
        }
        while (end > start && isWhitespace(value.codePointBefore(end))) {
            end -= Character.charCount(value.codePointBefore(end));
        }
        return value.substring(start, end);
    }

    public static String trimNewlines(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isNewline(value.charAt(start))) {
            start++;
        }
        while (end > start && isNewline(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Collapses every whitespace run to a single space and trims the result.
     */
    public static String normalizeWhitespace(String value) {
        return WHITESPACE_RUN.matcher(trim(value)).replaceAll(" ");
    }

    public static boolean startsWithWhitespace(String value) {
        return !value.isEmpty() && isWhitespace(value.codePointAt(0));
    }

    public static boolean endsWithWhitespace(String value) {
        return !value.isEmpty() && isWhitespace(value.codePointBefore(value.length()));
    }

    /**
     * Pads the result to end with exactly one blank line, leaves empty input untouched.
     */
    public static String ensureTwoTrailingNewlines(String value) {
        if (value.isEmpty()) {
            return value;
        }
        int trailingNewlines = 0;
        for (int i = value.length() - 1; i >= 0 && value.charAt(i) == '\n'; i--) {
            trailingNewlines++;
        }
        if (trailingNewlines == 0) {
            return value + "\n\n";
        }
        if (trailingNewlines == 1) {
            return value + "\n";
        }
        return value;
    }

    public static int width(String line) {
        return line.codePointCount(0, line.length());
    }

    private static boolean isNewline(char c) {
        return c == '\n' || c == '\r' || c == '\u000B' || c == '\f' || c == '\u0085' || c == '\u2028' || c == '\u2029';
    }

}
