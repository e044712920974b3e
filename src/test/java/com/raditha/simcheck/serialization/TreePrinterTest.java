package com.raditha.simcheck.serialization;

import com.raditha.simcheck.model.SyntaxNode;
import com.raditha.simcheck.normalization.SourceScanner;
import com.raditha.simcheck.parser.StructuralParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreePrinterTest {

    @Test
    void testIndentedDump() {
        SyntaxNode root = new StructuralParser().parse(SourceScanner.tokenize("int x;"));
        String nl = System.lineSeparator();

        String expected = "PROGRAM" + nl
                + "  STMT" + nl
                + "    TOKEN: KW" + nl
                + "    TOKEN: var_0" + nl;

        assertEquals(expected, new TreePrinter().dump(root));
    }

    @Test
    void testMarkerTextNotShownOnInnerNodes() {
        SyntaxNode root = new StructuralParser().parse(SourceScanner.tokenize("void f() { }"));
        String dump = new TreePrinter().dump(root);

        assertTrue(dump.contains("  FUNCTION"));
        assertFalse(dump.contains("FUNC_HEADER"));
        assertTrue(dump.contains("      TOKEN: var_0"));
    }
}
