package com.astrepr;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps one raw line of AST-repr text to a {@link LineToken}.
 *
 * Rules are applied in priority order:
 * <ol>
 *   <li>blank or comment-only - {@code Comment}</li>
 *   <li>a lone closing brace - {@code Close}</li>
 *   <li>a lone closing bracket - {@code ListEnd}</li>
 *   <li>{@code name: [} / {@code name [} - {@code ListStart}</li>
 *   <li>ends with an opening brace - {@code NodeOpen}</li>
 *   <li>{@code Kind: label {body}} on one line - {@code InlineNode}</li>
 *   <li>contains {@code ": "} - {@code KeyValue}</li>
 *   <li>anything else - {@code Comment}</li>
 * </ol>
 *
 * The classifier is stateless; nesting is tracked by {@link ReprParser}.
 */
public final class LineClassifier {

    private static final LineToken COMMENT = new LineToken.Comment();
    private static final LineToken CLOSE = new LineToken.Close();
    private static final LineToken LIST_END = new LineToken.ListEnd();

    // "arguments: [" and "arguments [" are both seen in dumps
    private static final Pattern LIST_START = Pattern.compile("^([A-Za-z][A-Za-z0-9_]*)\\s*:?\\s*\\[\\s*$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private LineClassifier() {
        // Utility class
    }

    public static LineToken classify(String line) {
        String stripped = stripComment(line).strip();
        if (stripped.isEmpty()) {
            return COMMENT;
        }
        if (stripped.equals("}")) {
            return CLOSE;
        }
        if (stripped.equals("]")) {
            return LIST_END;
        }

        Matcher listStart = LIST_START.matcher(stripped);
        if (listStart.matches()) {
            return new LineToken.ListStart(listStart.group(1));
        }

        if (stripped.endsWith(" {")) {
            LineToken.NodeOpen open = nodeOpen(stripped.substring(0, stripped.length() - 2).strip());
            // ": x {" names no kind
            return open.kind().isEmpty() ? COMMENT : open;
        }

        LineToken inline = inlineNode(stripped);
        if (inline != null) {
            return inline;
        }

        int separator = stripped.indexOf(": ");
        if (separator >= 0) {
            return new LineToken.KeyValue(
                stripped.substring(0, separator).strip(),
                stripped.substring(separator + 2).strip());
        }
        return COMMENT;
    }

    /**
     * Removes a {@code //} line comment that starts outside a double-quoted string.
     * Backslash escapes inside strings are honoured, so {@code "a\"//b"} is kept intact.
     */
    public static String stripComment(String line) {
        int comment = indexOutsideString(line, "//");
        return comment < 0 ? line : line.substring(0, comment).stripTrailing();
    }

    /**
     * Index of the first {@code target} that does not sit inside a double-quoted string,
     * or -1.
     */
    static int indexOutsideString(String line, String target) {
        int i = 0;
        int length = line.length();
        while (i < length) {
            char c = line.charAt(i);
            if (line.startsWith(target, i)) {
                return i;
            }
            if (c == '"') {
                i++;
                while (i < length && line.charAt(i) != '"') {
                    if (line.charAt(i) == '\\') {
                        i++;
                    }
                    i++;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Splits the text in front of {@code " {"} into kind and label.
     */
    static LineToken.NodeOpen nodeOpen(String head) {
        int colonSpace = head.indexOf(": ");
        if (colonSpace >= 0) {
            String kind = head.substring(0, colonSpace).strip();
            while (kind.endsWith(":")) {
                kind = kind.substring(0, kind.length() - 1);
            }
            return new LineToken.NodeOpen(kind, head.substring(colonSpace + 2).strip());
        }

        // "RefType: {" arrives here as "RefType:" - colon without a following space
        int colon = head.lastIndexOf(':');
        if (colon >= 0) {
            return new LineToken.NodeOpen(head.substring(0, colon).strip(), head.substring(colon + 1).strip());
        }

        Matcher run = WHITESPACE_RUN.matcher(head);
        int splitStart = -1;
        int splitEnd = -1;
        while (run.find()) {
            splitStart = run.start();
            splitEnd = run.end();
        }
        if (splitStart > 0) {
            return new LineToken.NodeOpen(head.substring(0, splitStart), head.substring(splitEnd));
        }
        return new LineToken.NodeOpen(head, "");
    }

    private static LineToken inlineNode(String stripped) {
        if (!stripped.endsWith("}")) {
            return null;
        }
        int open = indexOutsideString(stripped, " {");
        if (open <= 0) {
            return null;
        }
        // node kinds are capitalized, property keys are not: "ty: Foo { x }" stays a key/value
        if (!Character.isUpperCase(stripped.charAt(0))) {
            return null;
        }
        String head = stripped.substring(0, open).strip();
        String body = stripped.substring(open + 2, stripped.length() - 1).strip();
        LineToken.NodeOpen opening = nodeOpen(head);
        if (opening.kind().isEmpty() || opening.kind().contains(" ")) {
            return null;
        }
        LineToken bodyToken = classify(body);
        if (!(bodyToken instanceof LineToken.KeyValue)) {
            bodyToken = COMMENT;
        }
        return new LineToken.InlineNode(opening.kind(), opening.label(), bodyToken);
    }
}
