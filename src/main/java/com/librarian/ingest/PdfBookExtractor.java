package com.librarian.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;

public class PdfBookExtractor implements BookExtractor {

    @Override
    public List<String> extensions() {
        return List.of(".pdf");
    }

    @Override
    public Document extract(Path path) throws IOException {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            PDDocumentInformation info = pdf.getDocumentInformation();
            String title = info == null ? null : info.getTitle();
            String author = info == null ? null : info.getAuthor();
            String text = new PDFTextStripper().getText(pdf);
            return Document.of(path, title, author, BookExtractor.cleanText(text));
        } catch (IOException e) {
            throw new BookExtractionException(path, "Unable to read PDF", e);
        }
    }
}
