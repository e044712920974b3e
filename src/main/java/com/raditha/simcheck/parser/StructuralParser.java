package com.raditha.simcheck.parser;

import com.raditha.simcheck.model.KeywordKind;
import com.raditha.simcheck.model.NodeKind;
import com.raditha.simcheck.model.SyntaxNode;
import com.raditha.simcheck.model.Token;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Builds a structural tree from a token sequence.
 * <p>
 * Functions, blocks and control statements become nodes; everything else is
 * kept as opaque runs of leaves. The parser never fails on malformed input:
 * every loop consumes at least one token per iteration, so an incomplete
 * construct just yields a sparser tree.
 * <p>
 * Instances hold no state. Each construct parser takes the cursor and
 * returns the node it built, or null when nothing applies.
 */
public class StructuralParser {

    private static final String FUNCTION_HEADER = "FUNC_HEADER";
    private static final String ELSE_MARKER = "ELSE";
    private static final String CASE_BODY = "CASE BODY";
    private static final String DEFAULT_BODY = "DEFAULT BODY";

    /**
     * Parse a token sequence into a tree rooted at a PROGRAM node.
     *
     * @param tokens Tokens as produced by the scanner, normally ending with the end marker
     * @return Root of the structural tree
     */
    public SyntaxNode parse(List<Token> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);
        SyntaxNode root = new SyntaxNode(NodeKind.PROGRAM);

        while (!cursor.atEnd()) {
            int start = cursor.position();
            SyntaxNode node = looksLikeFunction(cursor) ? parseFunction(cursor) : parseStatement(cursor);
            addOrSkip(root, node, cursor, start);
        }
        return root;
    }

    /**
     * Decide whether the tokens at the cursor start a function definition.
     * A semicolon at parenthesis depth 0 means statement; a brace at depth 0
     * after a closed parenthesis pair means function.
     */
    boolean looksLikeFunction(TokenCursor cursor) {
        int depth = 0;
        boolean sawOpen = false;
        boolean sawClose = false;

        for (int i = 0; ; i++) {
            Token t = cursor.peek(i);
            if (t == null || t.isEnd()) {
                return false;
            }
            if (depth == 0 && t.isPunctuation(";")) {
                return false;
            }
            if (t.isPunctuation("(")) {
                depth++;
                sawOpen = true;
            } else if (t.isPunctuation(")")) {
                if (depth > 0) {
                    depth--;
                }
                if (depth == 0 && sawOpen) {
                    sawClose = true;
                }
            } else if (depth == 0 && t.isPunctuation("{")) {
                return sawOpen && sawClose;
            }
        }
    }

    /**
     * Function: opaque header up to the opening brace, then the body block.
     */
    SyntaxNode parseFunction(TokenCursor cursor) {
        SyntaxNode function = new SyntaxNode(NodeKind.FUNCTION);
        SyntaxNode header = new SyntaxNode(NodeKind.STMT, FUNCTION_HEADER);

        while (!cursor.atEnd() && !cursor.atPunctuation("{")) {
            header.addChild(SyntaxNode.leaf(cursor.consume()));
        }
        function.addChild(header);
        function.addChild(parseBlock(cursor));
        return function;
    }

    @Nullable
    SyntaxNode parseStatement(TokenCursor cursor) {
        Token t = cursor.current();
        if (t == null || t.isEnd()) {
            return null;
        }
        if (t.isPunctuation("{")) {
            return parseBlock(cursor);
        }

        return switch (t.keyword()) {
            case IF -> parseIf(cursor);
            case FOR -> parseLoopOrSwitch(cursor, NodeKind.FOR);
            case WHILE -> parseLoopOrSwitch(cursor, NodeKind.WHILE);
            case DO -> parseDoWhile(cursor);
            case SWITCH -> parseLoopOrSwitch(cursor, NodeKind.SWITCH);
            case CASE -> parseCase(cursor);
            case DEFAULT -> parseDefault(cursor);
            case RETURN -> parseReturn(cursor);
            case BREAK -> parseJump(cursor, NodeKind.BREAK);
            case CONTINUE -> parseJump(cursor, NodeKind.CONTINUE);
            // non-keyword tokens carry UNKNOWN
            default -> parseUntilSeparator(cursor, NodeKind.STMT);
        };
    }

    /**
     * Block: statements between matching braces. A missing closing brace ends
     * the block at end of input.
     */
    @Nullable
    SyntaxNode parseBlock(TokenCursor cursor) {
        if (!cursor.atPunctuation("{")) {
            return null;
        }
        cursor.consume();

        SyntaxNode block = new SyntaxNode(NodeKind.BLOCK);
        while (!cursor.atEnd() && !cursor.atPunctuation("}")) {
            int start = cursor.position();
            addOrSkip(block, parseStatement(cursor), cursor, start);
        }

        if (cursor.atPunctuation("}")) {
            cursor.consume();
        }
        return block;
    }

    /**
     * Parenthesized header captured as an expression bag. Only the outermost
     * pair delimits the header; inner parentheses stay as leaves.
     */
    @Nullable
    SyntaxNode parseParenExpr(TokenCursor cursor) {
        if (!cursor.atPunctuation("(")) {
            return null;
        }
        cursor.consume();

        SyntaxNode expr = new SyntaxNode(NodeKind.EXPR);
        int depth = 1;
        while (!cursor.atEnd()) {
            Token t = cursor.consume();
            if (t.isPunctuation("(")) {
                depth++;
            } else if (t.isPunctuation(")")) {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            expr.addChild(SyntaxNode.leaf(t));
        }
        return expr;
    }

    SyntaxNode parseIf(TokenCursor cursor) {
        cursor.consume();
        SyntaxNode node = new SyntaxNode(NodeKind.IF);
        node.addChild(parseParenExpr(cursor));
        node.addChild(parseStatement(cursor));

        if (cursor.atKeyword(KeywordKind.ELSE)) {
            cursor.consume();
            SyntaxNode elseBranch = new SyntaxNode(NodeKind.BLOCK, ELSE_MARKER);
            elseBranch.addChild(parseStatement(cursor));
            node.addChild(elseBranch);
        }
        return node;
    }

    /**
     * for, while and switch share the shape: keyword, header, one body statement.
     */
    SyntaxNode parseLoopOrSwitch(TokenCursor cursor, NodeKind kind) {
        cursor.consume();
        SyntaxNode node = new SyntaxNode(kind);
        node.addChild(parseParenExpr(cursor));
        node.addChild(parseStatement(cursor));
        return node;
    }

    SyntaxNode parseDoWhile(TokenCursor cursor) {
        cursor.consume();
        SyntaxNode node = new SyntaxNode(NodeKind.DO_WHILE);
        node.addChild(parseStatement(cursor));

        if (cursor.atKeyword(KeywordKind.WHILE)) {
            cursor.consume();
            node.addChild(parseParenExpr(cursor));
            if (cursor.atPunctuation(";")) {
                cursor.consume();
            }
        }
        return node;
    }

    SyntaxNode parseCase(TokenCursor cursor) {
        cursor.consume();
        SyntaxNode node = new SyntaxNode(NodeKind.CASE);

        SyntaxNode label = new SyntaxNode(NodeKind.EXPR);
        while (!cursor.atEnd() && !cursor.atPunctuation(":")
                && !cursor.atPunctuation("{") && !cursor.atPunctuation("}")) {
            label.addChild(SyntaxNode.leaf(cursor.consume()));
        }
        if (cursor.atPunctuation(":")) {
            cursor.consume();
        }
        node.addChild(label);
        node.addChild(parseCaseBody(cursor, CASE_BODY));
        return node;
    }

    SyntaxNode parseDefault(TokenCursor cursor) {
        cursor.consume();
        SyntaxNode node = new SyntaxNode(NodeKind.DEFAULT);
        if (cursor.atPunctuation(":")) {
            cursor.consume();
        }
        node.addChild(parseCaseBody(cursor, DEFAULT_BODY));
        return node;
    }

    /**
     * Statements up to the next case label, default label or closing brace.
     */
    private SyntaxNode parseCaseBody(TokenCursor cursor, String marker) {
        SyntaxNode body = new SyntaxNode(NodeKind.BLOCK, marker);
        while (!cursor.atEnd() && !cursor.atKeyword(KeywordKind.CASE)
                && !cursor.atKeyword(KeywordKind.DEFAULT) && !cursor.atPunctuation("}")) {
            int start = cursor.position();
            addOrSkip(body, parseStatement(cursor), cursor, start);
        }
        return body;
    }

    SyntaxNode parseReturn(TokenCursor cursor) {
        cursor.consume();
        SyntaxNode node = new SyntaxNode(NodeKind.RETURN);
        node.addChild(parseUntilSeparator(cursor, NodeKind.EXPR));
        return node;
    }

    /**
     * break and continue: the keyword and an optional semicolon, no children.
     */
    SyntaxNode parseJump(TokenCursor cursor, NodeKind kind) {
        cursor.consume();
        if (cursor.atPunctuation(";")) {
            cursor.consume();
        }
        return new SyntaxNode(kind);
    }

    /**
     * Collect leaves up to a semicolon outside parentheses and brackets. The
     * semicolon is consumed but not kept. Stops without consuming at a brace
     * so that block structure is never swallowed.
     */
    SyntaxNode parseUntilSeparator(TokenCursor cursor, NodeKind kind) {
        SyntaxNode node = new SyntaxNode(kind);
        int parens = 0;
        int brackets = 0;

        while (!cursor.atEnd()) {
            Token t = cursor.current();

            if (t.isPunctuation("(")) {
                parens++;
            } else if (t.isPunctuation(")") && parens > 0) {
                parens--;
            }
            if (t.isPunctuation("[")) {
                brackets++;
            } else if (t.isPunctuation("]") && brackets > 0) {
                brackets--;
            }

            if (parens == 0 && brackets == 0) {
                if (t.isPunctuation(";")) {
                    cursor.consume();
                    break;
                }
                if (t.isPunctuation("{") || t.isPunctuation("}")) {
                    break;
                }
            }

            cursor.consume();
            node.addChild(SyntaxNode.leaf(t));
        }
        return node;
    }

    /**
     * Keep a parsed node, or skip one token when the attempt consumed nothing.
     */
    private static void addOrSkip(SyntaxNode parent, @Nullable SyntaxNode node, TokenCursor cursor, int start) {
        if (node == null || cursor.position() == start) {
            cursor.consume();
            return;
        }
        parent.addChild(node);
    }
}
