package com.raditha.simcheck.analyzer;

import com.raditha.simcheck.model.FailureKind;
import com.raditha.simcheck.model.InputFailure;
import com.raditha.simcheck.model.SyntaxNode;
import com.raditha.simcheck.model.Token;
import com.raditha.simcheck.normalization.SourceScanner;
import com.raditha.simcheck.parser.StructuralParser;
import com.raditha.simcheck.serialization.TreePrinter;
import com.raditha.simcheck.serialization.TreeSerializer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a single source through scanning, parsing and serialization.
 * <p>
 * Malformed syntax never fails here. Only missing text, text without tokens,
 * or running out of stack or heap while building or flattening the tree are
 * reported, each as its own {@link FailureKind}.
 */
public class SourceProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SourceProcessor.class);

    private final StructuralParser parser;
    private final TreeSerializer serializer;

    public SourceProcessor() {
        this(new StructuralParser(), new TreeSerializer());
    }

    SourceProcessor(StructuralParser parser, TreeSerializer serializer) {
        this.parser = parser;
        this.serializer = serializer;
    }

    /**
     * Turn raw text into a label sequence.
     *
     * @param name Input name used in failures and log messages
     * @param text Raw source text, null when the source could not be supplied
     * @return Label sequence and token count, or the failure
     */
    public ProcessedSource process(String name, @Nullable String text) {
        if (text == null) {
            return ProcessedSource.failed(new InputFailure(name, FailureKind.EMPTY_OR_UNREADABLE));
        }

        List<Token> tokens = SourceScanner.tokenize(text);
        int tokenCount = tokens.size() - 1;
        logger.debug("{}: {} tokens", name, tokenCount);
        if (tokenCount == 0) {
            return ProcessedSource.failed(new InputFailure(name, FailureKind.ZERO_TOKENS));
        }

        SyntaxNode tree;
        try {
            tree = parser.parse(tokens);
            if (logger.isDebugEnabled()) {
                logger.debug("{}: tree with {} nodes", name, tree.size());
            }
        } catch (StackOverflowError | OutOfMemoryError e) {
            logger.warn("{}: ran out of resources while parsing ({})", name, e.getClass().getSimpleName());
            return ProcessedSource.failed(new InputFailure(name, FailureKind.PARSE_FAILURE,
                    "parse failure: " + describe(e)));
        }

        List<String> labels;
        try {
            labels = serializer.serialize(tree);
        } catch (StackOverflowError | OutOfMemoryError e) {
            logger.warn("{}: ran out of resources while serializing ({})", name, e.getClass().getSimpleName());
            return ProcessedSource.failed(new InputFailure(name, FailureKind.SERIALIZATION_FAILURE,
                    "serialization failure: " + describe(e)));
        }
        logger.debug("{}: {} labels", name, labels.size());

        return ProcessedSource.succeeded(name, labels, tokenCount);
    }

    /**
     * Render the structural tree of a text for debugging.
     *
     * @throws StackOverflowError if the text nests too deeply to walk
     */
    public String dumpTree(String text) {
        return new TreePrinter().dump(parser.parse(SourceScanner.tokenize(text)));
    }

    private static String describe(Error e) {
        if (e instanceof StackOverflowError) {
            return "nesting too deep";
        }
        return "out of memory";
    }
}
