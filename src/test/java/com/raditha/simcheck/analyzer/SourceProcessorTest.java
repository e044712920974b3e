package com.raditha.simcheck.analyzer;

import com.raditha.simcheck.model.FailureKind;
import com.raditha.simcheck.model.SyntaxNode;
import com.raditha.simcheck.parser.StructuralParser;
import com.raditha.simcheck.serialization.TreeSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Tests for SourceProcessor failure classification.
 */
class SourceProcessorTest {

    private final SourceProcessor processor = new SourceProcessor();

    @Test
    void testMissingTextIsUnreadable() {
        ProcessedSource source = processor.process("a.c", null);

        assertFalse(source.isSuccess());
        assertEquals(FailureKind.EMPTY_OR_UNREADABLE, source.failure().kind());
        assertEquals("a.c", source.name());
        assertNull(source.labels());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  \n\t", "// nothing here", "/* nor here */", "@ # $"})
    void testNoTokensIsZeroTokens(String text) {
        ProcessedSource source = processor.process("a.c", text);

        assertEquals(FailureKind.ZERO_TOKENS, source.failure().kind());
    }

    @Test
    void testIncompleteDeclarationProcessed() {
        ProcessedSource source = processor.process("a.c", "int x");

        assertTrue(source.isSuccess());
        assertEquals(2, source.tokenCount());
        assertFalse(source.labels().isEmpty());
        assertEquals("<PROGRAM>", source.labels().get(0));
    }

    @Test
    void testParserStackExhaustion() {
        StructuralParser parser = mock(StructuralParser.class);
        TreeSerializer serializer = mock(TreeSerializer.class);
        when(parser.parse(anyList())).thenThrow(new StackOverflowError());

        ProcessedSource source = new SourceProcessor(parser, serializer).process("deep.c", "int x;");

        assertEquals(FailureKind.PARSE_FAILURE, source.failure().kind());
        assertEquals("parse failure: nesting too deep", source.failure().detail());
        verifyNoInteractions(serializer);
    }

    @Test
    void testSerializerMemoryExhaustion() {
        TreeSerializer serializer = mock(TreeSerializer.class);
        when(serializer.serialize(any())).thenThrow(new OutOfMemoryError());

        ProcessedSource source = new SourceProcessor(new StructuralParser(), serializer).process("big.c", "int x;");

        assertEquals(FailureKind.SERIALIZATION_FAILURE, source.failure().kind());
        assertEquals("serialization failure: out of memory", source.failure().detail());
    }

    @Test
    void testTreeNotWalkedForLoggingWhenDebugOff() {
        StructuralParser parser = mock(StructuralParser.class);
        TreeSerializer serializer = mock(TreeSerializer.class);
        SyntaxNode tree = mock(SyntaxNode.class);
        when(parser.parse(anyList())).thenReturn(tree);
        when(serializer.serialize(tree)).thenReturn(List.of("<PROGRAM>", "</PROGRAM>"));

        ProcessedSource source = new SourceProcessor(parser, serializer).process("a.c", "int x;");

        assertTrue(source.isSuccess());
        verify(tree, never()).size();
    }

    @Test
    void testDeepNestingReportedNotThrown() {
        String text = "{".repeat(200_000);

        ProcessedSource source = processor.process("nested.c", text);

        assertFalse(source.isSuccess());
        FailureKind kind = source.failure().kind();
        assertTrue(kind == FailureKind.PARSE_FAILURE || kind == FailureKind.SERIALIZATION_FAILURE,
                "unexpected failure " + kind);
    }

    @Test
    void testDumpTree() {
        String dump = processor.dumpTree("return 0;");

        assertTrue(dump.startsWith("PROGRAM"));
        assertTrue(dump.contains("RETURN"));
        assertTrue(dump.contains("TOKEN: NUM"));
    }
}
