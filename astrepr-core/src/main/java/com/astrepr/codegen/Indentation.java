package com.astrepr.codegen;

/**
 * Re-indentation of multi-line renderings that are embedded at a deeper nesting level.
 */
public final class Indentation {

    private Indentation() {
        // Utility class
    }

    /**
     * Strips the whitespace common to all non-blank lines and prefixes every non-blank line
     * with {@code indent}. Blank lines come out empty.
     */
    public static String reindent(String text, String indent) {
        String[] lines = text.split("\n", -1);
        int common = commonIndent(lines);
        StringBuilder out = new StringBuilder(text.length() + lines.length * indent.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            if (!lines[i].isBlank()) {
                out.append(indent).append(lines[i], common, lines[i].length());
            }
        }
        return out.toString();
    }

    private static int commonIndent(String[] lines) {
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int leading = 0;
            while (leading < line.length() && Character.isWhitespace(line.charAt(leading))) {
                leading++;
            }
            common = Math.min(common, leading);
        }
        return common == Integer.MAX_VALUE ? 0 : common;
    }
}
