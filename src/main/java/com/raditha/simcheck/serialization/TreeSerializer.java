package com.raditha.simcheck.serialization;

import com.raditha.simcheck.model.NodeKind;
import com.raditha.simcheck.model.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattens a structural tree into a comparable label sequence.
 * <p>
 * Preorder walk that brackets every node with {@code <KIND>} and {@code </KIND>}
 * and writes leaf text in between, so the sequence captures nesting as well
 * as leaf content:
 *
 * <pre>
 * IF(EXPR(x), BLOCK) -> &lt;IF&gt; &lt;EXPR&gt; &lt;TOKEN&gt; x &lt;/TOKEN&gt; &lt;/EXPR&gt; &lt;BLOCK&gt; &lt;/BLOCK&gt; &lt;/IF&gt;
 * </pre>
 */
public class TreeSerializer {

    /**
     * Serialize a tree.
     *
     * @param root Root node; null yields an empty sequence
     * @return Unmodifiable label sequence
     */
    public List<String> serialize(@Nullable SyntaxNode root) {
        List<String> labels = new ArrayList<>();
        emit(root, labels);
        return Collections.unmodifiableList(labels);
    }

    private void emit(@Nullable SyntaxNode node, List<String> out) {
        if (node == null) {
            return;
        }

        out.add(openLabel(node.kind()));
        if (node.isLeaf() && node.text() != null) {
            out.add(node.text());
        }
        for (SyntaxNode child : node.children()) {
            emit(child, out);
        }
        out.add(closeLabel(node.kind()));
    }

    static String openLabel(NodeKind kind) {
        return "<" + kind.name() + ">";
    }

    static String closeLabel(NodeKind kind) {
        return "</" + kind.name() + ">";
    }
}
