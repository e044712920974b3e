package com.raditha.simcheck.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the raw text of a source.
 * An empty source is returned as an empty string; only an unreadable one throws.
 */
public interface SourceReader {

    String read(Path path) throws IOException;
}
