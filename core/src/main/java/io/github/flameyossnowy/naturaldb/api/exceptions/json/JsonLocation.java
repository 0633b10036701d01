package io.github.flameyossnowy.naturaldb.api.exceptions.json;

/**
 * Position inside a JSON text. Lines and columns are 1-based, the offset is 0-based.
 */
public record JsonLocation(int lineNumber, int columnNumber, long charOffset) {
    public static final JsonLocation UNKNOWN = new JsonLocation(-1, -1, -1);

    public static JsonLocation of(String text, int offset) {
        int line = 1;
        int column = 1;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new JsonLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return "line " + lineNumber + ", column " + columnNumber + " (offset " + charOffset + ')';
    }
}
