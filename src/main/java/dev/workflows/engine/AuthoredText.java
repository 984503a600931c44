package dev.workflows.engine;

/**
 * Checks on text typed into the editor. Blank means nothing but whitespace,
 * where no-break spaces and the byte order mark count as whitespace too.
 */
final class AuthoredText {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private AuthoredText() {}

    static boolean isBlank(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isSpaceChar(c) && c != BYTE_ORDER_MARK) {
                return false;
            }
        }
        return true;
    }
}
