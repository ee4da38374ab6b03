package com.astrepr.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic node of a parsed AST-repr tree.
 *
 * A node is identified by its {@code kind} (e.g. "ClassDecl") and an optional free-form
 * {@code label} taken from its opening line. Scalar properties hold {@code key: value} lines,
 * list properties hold named {@code [ ... ]} sections and {@code children} hold nested nodes
 * in source order.
 *
 * Instances are immutable; use {@link #builder(String, String)} to assemble one.
 */
public record ReprNode(
    String kind,
    String label,
    String literalValue,  // Only set for LitConstExpr
    Map<String, String> scalarProps,
    Map<String, List<ReprNode>> listProps,
    List<ReprNode> children
) {
    public static final String POSITION = "position";

    public ReprNode {
        Objects.requireNonNull(kind, "kind");
        if (kind.isEmpty()) {
            throw new IllegalArgumentException("Node kind must not be empty");
        }
        label = label == null ? "" : label;
        scalarProps = Collections.unmodifiableMap(new LinkedHashMap<>(scalarProps));
        Map<String, List<ReprNode>> lists = new LinkedHashMap<>();
        listProps.forEach((key, value) -> lists.put(key, List.copyOf(value)));
        listProps = Collections.unmodifiableMap(lists);
        children = List.copyOf(children);
    }

    public ReprNode(String kind, String label) {
        this(kind, label, null, Map.of(), Map.of(), List.of());
    }

    public static Builder builder(String kind, String label) {
        return new Builder(kind, label);
    }

    public boolean is(String expectedKind) {
        return kind.equals(expectedKind);
    }

    public Optional<String> scalar(String key) {
        return Optional.ofNullable(scalarProps.get(key));
    }

    /**
     * Raw {@code position} property, exactly as it appeared in the dump.
     */
    public Optional<String> position() {
        return scalar(POSITION);
    }

    public List<ReprNode> list(String key) {
        return listProps.getOrDefault(key, List.of());
    }

    public Optional<ReprNode> firstChild(String childKind) {
        for (ReprNode child : children) {
            if (child.is(childKind)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<ReprNode> childrenOf(String childKind) {
        List<ReprNode> matching = new ArrayList<>();
        for (ReprNode child : children) {
            if (child.is(childKind)) {
                matching.add(child);
            }
        }
        return matching;
    }

    /**
     * Mutable accumulator used while a node's body is being read. Discarded once
     * {@link #build()} has been called.
     */
    public static final class Builder {
        private final String kind;
        private String label;
        private String literalValue;
        private final Map<String, String> scalarProps = new LinkedHashMap<>();
        private final Map<String, List<ReprNode>> listProps = new LinkedHashMap<>();
        private final List<ReprNode> children = new ArrayList<>();

        private Builder(String kind, String label) {
            this.kind = kind;
            this.label = label;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder literalValue(String literalValue) {
            this.literalValue = literalValue;
            return this;
        }

        public Builder scalar(String key, String value) {
            scalarProps.put(key, value);
            return this;
        }

        /**
         * Opens (or reopens) a list property and returns the live list to append to.
         */
        public List<ReprNode> openList(String key) {
            return listProps.computeIfAbsent(key, k -> new ArrayList<>());
        }

        public Builder child(ReprNode child) {
            children.add(child);
            return this;
        }

        public ReprNode build() {
            return new ReprNode(kind, label, literalValue, scalarProps, listProps, children);
        }
    }
}
