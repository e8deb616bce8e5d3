package com.declo.syntax;

/**
 * Malformed chain or comprehension text. Carries the input, the offset of the
 * offending token and its text.
 */
public class DecloSyntaxException extends IllegalArgumentException {

    private final String source;
    private final int offset;
    private final String near;
    private final String reason;

    public DecloSyntaxException(String reason, String source, int offset, String near) {
        super(describe(reason, source, offset, near));
        this.source = source;
        this.offset = offset;
        this.near = near;
        this.reason = reason;
    }

    public DecloSyntaxException(String reason, String source, int offset, String near, Throwable cause) {
        this(reason, source, offset, near);
        initCause(cause);
    }

    public String getSource() {
        return source;
    }

    public int getOffset() {
        return offset;
    }

    public String getNear() {
        return near;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return lineOf(source, offset);
    }

    public int getColumn() {
        return columnOf(source, offset);
    }

    private static int lineOf(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String source, int offset) {
        return offset - (source.lastIndexOf('\n', offset - 1) + 1) + 1;
    }

    private static String describe(String reason, String source, int offset, String near) {
        String where = lineOf(source, offset) + ":" + columnOf(source, offset);
        if (near == null || near.isEmpty()) {
            return "Syntax error at " + where + " at end of input: " + reason;
        }
        return "Syntax error at " + where + " near '" + near + "': " + reason;
    }
}
