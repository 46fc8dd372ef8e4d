package com.sexprefs.corpus;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

/**
 * Reads a file as UTF-8, replacing malformed bytes, and transparently inflates {@code .gz} files.
 */
record DiskSourceFile(Path path) implements SourceFile {

    DiskSourceFile {
        Objects.requireNonNull(path, "path");
    }

    @Override
    public SourceBuffer open() throws IOException {
        return new SourceBuffer(path, new String(readBytes(), StandardCharsets.UTF_8));
    }

    private byte[] readBytes() throws IOException {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        if (!fileName.endsWith(".gz")) {
            return Files.readAllBytes(path);
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            return in.readAllBytes();
        }
    }
}
