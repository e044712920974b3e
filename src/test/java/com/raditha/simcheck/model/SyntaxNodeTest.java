package com.raditha.simcheck.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxNodeTest {

    @Test
    void testNullChildIgnored() {
        SyntaxNode node = new SyntaxNode(NodeKind.IF).addChild(null);

        assertEquals(0, node.childCount());
    }

    @Test
    void testSelfAsChildRejected() {
        SyntaxNode node = new SyntaxNode(NodeKind.BLOCK);

        assertThrows(IllegalArgumentException.class, () -> node.addChild(node));
    }

    @Test
    void testChildrenAreReadOnly() {
        SyntaxNode node = new SyntaxNode(NodeKind.BLOCK).addChild(new SyntaxNode(NodeKind.STMT));

        assertThrows(UnsupportedOperationException.class, () -> node.children().clear());
    }

    @Test
    void testSizeCountsSubtree() {
        SyntaxNode stmt = new SyntaxNode(NodeKind.STMT)
                .addChild(new SyntaxNode(NodeKind.TOKEN, "var_0"))
                .addChild(new SyntaxNode(NodeKind.TOKEN, ";"));
        SyntaxNode root = new SyntaxNode(NodeKind.PROGRAM).addChild(stmt);

        assertEquals(4, root.size());
        assertTrue(stmt.child(0).isLeaf());
        assertFalse(stmt.isLeaf());
    }

    @Test
    void testLeafFromToken() {
        SyntaxNode leaf = SyntaxNode.leaf(new Token(TokenType.NUMBER, "NUM", "42", 3, 7));

        assertEquals(NodeKind.TOKEN, leaf.kind());
        assertEquals("NUM", leaf.text());
        assertEquals("TOKEN(NUM)", leaf.toString());
    }
}
