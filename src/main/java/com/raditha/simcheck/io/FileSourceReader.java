package com.raditha.simcheck.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads sources from the file system in a fixed encoding.
 * Malformed input for the encoding surfaces as an {@link IOException}.
 */
public class FileSourceReader implements SourceReader {

    private final Charset charset;

    public FileSourceReader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public String read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        return Files.readString(path, charset);
    }
}
