package com.librarian.store;

import com.librarian.ingest.Document;

public record BookMetadata(String title, String author, String filename, String format, int length) {
    public static BookMetadata of(Document document) {
        return new BookMetadata(
                document.title(),
                document.author(),
                document.filename(),
                document.format(),
                document.length());
    }
}
