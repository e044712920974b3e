package com.raditha.simcheck.serialization;

import com.raditha.simcheck.model.SyntaxNode;

/**
 * Renders a structural tree as indented text for debugging.
 */
public class TreePrinter {

    private static final String INDENT = "  ";

    public String dump(SyntaxNode root) {
        StringBuilder sb = new StringBuilder();
        append(root, 0, sb);
        return sb.toString();
    }

    private void append(SyntaxNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append(node.kind().name());
        if (node.isLeaf() && node.text() != null) {
            sb.append(": ").append(node.text());
        }
        sb.append(System.lineSeparator());

        for (SyntaxNode child : node.children()) {
            append(child, depth + 1, sb);
        }
    }
}
