package com.librarian.ingest;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public record Document(
        String id,
        String title,
        String author,
        String filename,
        String format,
        String text,
        int length) {

    public static final String UNKNOWN_AUTHOR = "Unknown";

    public static Document of(Path source, String title, String author, String text) {
        Path absolute = source.toAbsolutePath().normalize();
        String cleaned = text == null ? "" : text;
        return new Document(
                idFor(absolute),
                title == null || title.isBlank() ? stem(absolute) : title.strip(),
                author == null || author.isBlank() ? UNKNOWN_AUTHOR : author.strip(),
                absolute.toString(),
                formatOf(absolute),
                cleaned,
                cleaned.length());
    }

    public static String idFor(Path source) {
        String key = source.toAbsolutePath().normalize().toString();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8))).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String formatOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
