package com.usageprofile.counter.corpus;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One corpus file, read once and never mutated afterwards.
 *
 * @param relativePath {@code /}-separated path below the corpus root; the file's identity
 * @param absolutePath location on disk
 * @param content      raw bytes, the input of the content fingerprint
 * @param text         content decoded as UTF-8
 */
public record SourceFile(String relativePath, Path absolutePath, byte[] content, String text) {

    public static class UnreadableFileException extends RuntimeException {
        public UnreadableFileException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * Reads and strictly decodes a corpus file.
     *
     * @throws UnreadableFileException on I/O failure or bytes that are not valid UTF-8
     */
    public static SourceFile read(Path root, Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UnreadableFileException("Could not read " + file + ": " + e.getMessage(), e);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new UnreadableFileException("Broken encoding in " + file + ": " + e.getMessage(), e);
        }
        return new SourceFile(relativize(root, file), file, bytes, text);
    }

    /** Builds an in-memory source file; used for synthetic inputs. */
    public static SourceFile of(String relativePath, String text) {
        return new SourceFile(relativePath, Path.of(relativePath), text.getBytes(StandardCharsets.UTF_8), text);
    }

    public static String relativize(Path root, Path file) {
        Path rel = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        return rel.toString().replace('\\', '/');
    }
}
