package com.librarian.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

public class BookExtractors {
    private final List<BookExtractor> extractors;

    public BookExtractors() {
        this(List.of(new PdfBookExtractor(), new EpubBookExtractor(), new Fb2BookExtractor()));
    }

    public BookExtractors(List<BookExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public boolean supports(Path path) {
        return find(path).isPresent();
    }

    public Set<String> supportedExtensions() {
        Set<String> extensions = new TreeSet<>();
        extractors.forEach(extractor -> extensions.addAll(extractor.extensions()));
        return extensions;
    }

    public Document extract(Path path) throws IOException {
        BookExtractor extractor = find(path)
                .orElseThrow(() -> new BookExtractionException(path, "Unsupported format " + Document.formatOf(path)));
        return extractor.extract(path);
    }

    private Optional<BookExtractor> find(Path path) {
        return extractors.stream().filter(extractor -> extractor.supports(path)).findFirst();
    }
}
