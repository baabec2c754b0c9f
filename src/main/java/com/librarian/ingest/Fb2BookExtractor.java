package com.librarian.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

public class Fb2BookExtractor implements BookExtractor {

    @Override
    public List<String> extensions() {
        return List.of(".fb2");
    }

    @Override
    public Document extract(Path path) throws IOException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BookExtractionException(path, "Unable to read FB2", e);
        }
        org.jsoup.nodes.Document xml = Jsoup.parse(content, "", Parser.xmlParser());
        if (xml.selectFirst("FictionBook, body") == null) {
            throw new BookExtractionException(path, "Not a FictionBook document");
        }

        String title = null;
        String author = null;
        Element titleInfo = xml.selectFirst("title-info");
        if (titleInfo != null) {
            Element bookTitle = titleInfo.selectFirst("book-title");
            title = bookTitle == null ? null : bookTitle.text();
            Element authorElement = titleInfo.selectFirst("author");
            if (authorElement != null) {
                author = Stream.of(authorElement.selectFirst("first-name"), authorElement.selectFirst("last-name"))
                        .filter(element -> element != null && !element.text().isBlank())
                        .map(element -> element.text().strip())
                        .collect(Collectors.joining(" "));
            }
        }

        Element body = xml.selectFirst("body");
        String text;
        if (body != null) {
            body.select("style, script").remove();
            text = BookExtractor.textOf(body);
        } else {
            text = BookExtractor.textOf(xml);
        }
        return Document.of(path, title, author, BookExtractor.cleanText(text));
    }
}
