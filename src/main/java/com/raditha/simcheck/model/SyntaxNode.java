package com.raditha.simcheck.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of the structural tree.
 * A node exclusively owns its children; there are no parent links since the
 * tree is only ever walked top-down.
 */
public final class SyntaxNode {
    private final NodeKind kind;
    private final @Nullable String text;
    private final List<SyntaxNode> children = new ArrayList<>();

    public SyntaxNode(NodeKind kind) {
        this(kind, null);
    }

    public SyntaxNode(NodeKind kind, @Nullable String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
    }

    /**
     * Create a leaf from a scanned token.
     */
    public static SyntaxNode leaf(Token token) {
        return new SyntaxNode(NodeKind.TOKEN, token.leafLabel());
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Leaf label for TOKEN nodes, marker text (e.g. "ELSE") for some synthetic nodes.
     */
    public @Nullable String text() {
        return text;
    }

    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    /**
     * Append a child. Null children are ignored so that parse functions that
     * produced nothing can be added unconditionally.
     */
    public SyntaxNode addChild(@Nullable SyntaxNode child) {
        if (child != null) {
            if (child == this) {
                throw new IllegalArgumentException("A node cannot own itself");
            }
            children.add(child);
        }
        return this;
    }

    public boolean isLeaf() {
        return kind == NodeKind.TOKEN;
    }

    /**
     * Total number of nodes in this subtree, this node included.
     */
    public int size() {
        int count = 1;
        for (SyntaxNode child : children) {
            count += child.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return text == null ? kind.name() : kind.name() + "(" + text + ")";
    }
}
