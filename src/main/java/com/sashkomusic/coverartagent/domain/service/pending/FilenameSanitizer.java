package com.sashkomusic.coverartagent.domain.service.pending;

/**
 * Turns free-form tag values into tokens that are safe in a file name.
 */
public final class FilenameSanitizer {

    static final String UNKNOWN = "unknown";

    private FilenameSanitizer() {
    }

    public static String sanitize(String value) {
        StringBuilder out = new StringBuilder();
        if (value != null) {
            for (int i = 0; i < value.length(); ) {
                int cp = value.codePointAt(i);
                if (isAsciiAlphanumeric(cp)) {
                    out.appendCodePoint(cp);
                } else if (isWhitespace(cp) || cp == '-' || cp == '_') {
                    out.append('_');
                }
                i += Character.charCount(cp);
            }
        }
        return out.length() == 0 ? UNKNOWN : out.toString();
    }

    // Unicode White_Space: no-break spaces and NEL count, the 0x1C-0x1F separators do not
    private static boolean isWhitespace(int cp) {
        if (cp >= 0x1C && cp <= 0x1F) {
            return false;
        }
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
    }

    private static boolean isAsciiAlphanumeric(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || (cp >= '0' && cp <= '9');
    }
}
