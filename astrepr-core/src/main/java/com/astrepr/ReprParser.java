package com.astrepr;

import com.astrepr.tree.ReprNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds a {@link ReprNode} tree from AST-repr text.
 *
 * Nesting is delimited by braces (nodes) and brackets (named lists) only; indentation is
 * ignored. Everything below the root is parsed best-effort: noise inside lists is skipped,
 * a body that never sees its closing brace ends at end of input, and unrecognized lines are
 * dropped. Every loop consumes at least one line per iteration, so parsing always terminates.
 */
public class ReprParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReprParser.class);

    static final String FILE = "File";
    static final String PACKAGE = "Package";
    static final String LITERAL = "LitConstExpr";

    private final LineReader reader;

    public ReprParser(String source) {
        this(source.lines().toList());
    }

    public ReprParser(List<String> lines) {
        this.reader = new LineReader(lines);
    }

    /**
     * Parses the whole input and returns the effective {@code File} root.
     *
     * @throws FormatException if the input is empty or the root is not a File
     *         (or a Package wrapping a File)
     */
    public ReprNode parse() {
        LineToken first = reader.advance();
        if (first == null) {
            throw new FormatException("Empty input");
        }
        if (!(first instanceof LineToken.NodeOpen open)) {
            throw new FormatException("Expected 'File: <name> {' on the first line, got " + describe(first), 1);
        }

        ReprNode root = parseNode(open.kind(), open.label());
        if (!reader.isAtEnd()) {
            LOGGER.debug("Ignoring content after the root node, starting at line {}", reader.lineNumber() + 1);
        }

        if (root.is(FILE)) {
            return root;
        }
        if (root.is(PACKAGE)) {
            List<ReprNode> files = root.childrenOf(FILE);
            if (files.size() != 1) {
                throw new FormatException("Package root must contain exactly one File node, found " + files.size());
            }
            return files.get(0);
        }
        throw new FormatException("Expected File or Package root, got '" + root.kind() + "'", 1);
    }

    /**
     * Reads the body of a node whose opening line has just been consumed, up to and
     * including its closing brace.
     */
    private ReprNode parseNode(String kind, String label) {
        ReprNode.Builder builder = newBuilder(kind, label);

        while (!reader.isAtEnd()) {
            LineToken token = reader.advance();

            if (token instanceof LineToken.Close) {
                return builder.build();
            }
            if (token instanceof LineToken.ListStart listStart) {
                parseList(builder, listStart.key());
            } else if (token instanceof LineToken.KeyValue keyValue) {
                builder.scalar(keyValue.key(), keyValue.value());
            } else if (token instanceof LineToken.NodeOpen open) {
                builder.child(parseNode(open.kind(), open.label()));
            } else if (token instanceof LineToken.InlineNode inline) {
                builder.child(inlineNode(inline));
            }
            // Comment and stray ListEnd lines carry nothing at node level
        }

        LOGGER.debug("Input ended inside the body of {} '{}'", kind, label);
        return builder.build();
    }

    private void parseList(ReprNode.Builder owner, String key) {
        List<ReprNode> elements = owner.openList(key);

        while (!reader.isAtEnd()) {
            LineToken token = reader.advance();

            if (token instanceof LineToken.ListEnd) {
                return;
            }
            if (token instanceof LineToken.NodeOpen open) {
                elements.add(parseNode(open.kind(), open.label()));
            } else if (token instanceof LineToken.InlineNode inline) {
                elements.add(inlineNode(inline));
            } else if (!(token instanceof LineToken.Comment)) {
                LOGGER.debug("Skipping {} inside list '{}' at line {}", describe(token), key, reader.lineNumber());
            }
        }
    }

    private static ReprNode inlineNode(LineToken.InlineNode inline) {
        ReprNode.Builder builder = newBuilder(inline.kind(), inline.label());
        if (inline.body() instanceof LineToken.KeyValue keyValue) {
            builder.scalar(keyValue.key(), keyValue.value());
        }
        return builder.build();
    }

    private static ReprNode.Builder newBuilder(String kind, String label) {
        ReprNode.Builder builder = ReprNode.builder(kind, label);
        if (LITERAL.equals(kind)) {
            splitLiteral(builder, label);
        }
        return builder;
    }

    /**
     * A literal opened as {@code LitConstExpr: String "hello"} stores {@code String} as the
     * label and {@code hello} as the literal value.
     */
    private static void splitLiteral(ReprNode.Builder builder, String label) {
        String text = label.strip();
        int space = indexOfWhitespace(text);
        if (space < 0) {
            builder.label(text);
            return;
        }
        builder.label(text.substring(0, space));
        builder.literalValue(unquote(text.substring(space).strip()));
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String describe(LineToken token) {
        return token.getClass().getSimpleName();
    }

    public static ReprNode parse(String source) {
        return new ReprParser(source).parse();
    }

    public static ReprNode parse(List<String> lines) {
        return new ReprParser(lines).parse();
    }
}
