package com.vulnstructure.engine.support;

/**
 * Text capping helpers. Lengths count Unicode code points, so a cap never splits
 * a surrogate pair.
 */
public final class Texts {

    public static final String UNKNOWN_ERROR = "Unknown error";

    private static final String ELLIPSIS = "...";

    private Texts() {}

    /** The first {@code max} code points of {@code text}; null becomes "". */
    public static String truncate(String text, int max) {
        if (text == null) return "";
        if (text.codePointCount(0, text.length()) <= max) return text;
        return text.substring(0, text.offsetByCodePoints(0, max));
    }

    /**
     * Normalizes an error message for a result record: whitespace runs collapse to a
     * single space, and a message longer than {@code max} keeps {@code max - 3}
     * code points followed by "...".
     */
    public static String cleanErrorMessage(String message, int max) {
        if (message == null) return UNKNOWN_ERROR;
        String cleaned = message.strip().replaceAll("\\s+", " ");
        if (cleaned.isEmpty()) return UNKNOWN_ERROR;
        if (cleaned.codePointCount(0, cleaned.length()) > max) {
            return truncate(cleaned, max - ELLIPSIS.length()) + ELLIPSIS;
        }
        return cleaned;
    }

    /** Message of a throwable, falling back to its simple class name. */
    public static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
