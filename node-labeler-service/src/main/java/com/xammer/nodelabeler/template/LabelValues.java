package com.xammer.nodelabeler.template;

/**
 * Character rules for Kubernetes label values: at most 63 characters, empty or
 * starting and ending with an alphanumeric, with {@code -_.} and alphanumerics between.
 */
public final class LabelValues {

    public static final int MAX_LENGTH = 63;
    public static final char SUBSTITUTE = '_';

    private LabelValues() {
    }

    public static boolean isAllowed(char c) {
        return isAlphanumeric(c) || c == '-' || c == '_' || c == '.';
    }

    /**
     * Replaces every character a label value cannot carry with {@link #SUBSTITUTE}.
     */
    public static String substitute(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!isAllowed(c)) {
                if (sb == null) {
                    sb = new StringBuilder(value);
                }
                sb.setCharAt(i, SUBSTITUTE);
            }
        }
        return sb == null ? value : sb.toString();
    }

    /**
     * @return null when the value is a valid label value, otherwise the reason it is not
     */
    public static String violation(String value) {
        if (value.isEmpty()) {
            return null;
        }
        if (value.length() > MAX_LENGTH) {
            return "longer than " + MAX_LENGTH + " characters";
        }
        if (!isAlphanumeric(value.charAt(0)) || !isAlphanumeric(value.charAt(value.length() - 1))) {
            return "must start and end with an alphanumeric character";
        }
        for (int i = 0; i < value.length(); i++) {
            if (!isAllowed(value.charAt(i))) {
                return "invalid character '" + value.charAt(i) + "'";
            }
        }
        return null;
    }

    private static boolean isAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
