package com.librarian.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

public class EpubBookExtractor implements BookExtractor {
    private static final String CONTAINER = "META-INF/container.xml";
    private static final String XHTML = "application/xhtml+xml";

    @Override
    public List<String> extensions() {
        return List.of(".epub");
    }

    @Override
    public Document extract(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile(), StandardCharsets.UTF_8)) {
            String packagePath = packageDocumentPath(zip, path);
            org.jsoup.nodes.Document opf = Jsoup.parse(read(zip, packagePath, path), "", Parser.xmlParser());

            Element title = opf.selectFirst("dc|title, title");
            Element creator = opf.selectFirst("dc|creator, creator");

            String baseDir = packagePath.contains("/") ? packagePath.substring(0, packagePath.lastIndexOf('/') + 1) : "";
            StringBuilder text = new StringBuilder();
            for (String href : contentDocuments(opf)) {
                String entryName = baseDir + URLDecoder.decode(href, StandardCharsets.UTF_8);
                if (zip.getEntry(entryName) == null) {
                    continue;
                }
                org.jsoup.nodes.Document html = Jsoup.parse(read(zip, entryName, path));
                text.append(BookExtractor.textOf(html.body())).append('\n');
            }

            return Document.of(
                    path,
                    title == null ? null : title.text(),
                    creator == null ? null : creator.text(),
                    BookExtractor.cleanText(text.toString()));
        } catch (ZipException e) {
            throw new BookExtractionException(path, "Not a valid EPUB archive", e);
        }
    }

    private static String packageDocumentPath(ZipFile zip, Path path) throws IOException {
        org.jsoup.nodes.Document container = Jsoup.parse(read(zip, CONTAINER, path), "", Parser.xmlParser());
        Element rootFile = container.selectFirst("rootfile[full-path]");
        if (rootFile == null) {
            throw new BookExtractionException(path, "EPUB container does not name a package document");
        }
        return rootFile.attr("full-path");
    }

    // spine order first, then any XHTML manifest items the spine left out
    private static List<String> contentDocuments(org.jsoup.nodes.Document opf) {
        Map<String, String> manifest = new LinkedHashMap<>();
        for (Element item : opf.select("manifest > item")) {
            if (XHTML.equals(item.attr("media-type"))) {
                manifest.put(item.attr("id"), item.attr("href"));
            }
        }
        List<String> ordered = new ArrayList<>();
        for (Element itemRef : opf.select("spine > itemref")) {
            String href = manifest.remove(itemRef.attr("idref"));
            if (href != null) {
                ordered.add(href);
            }
        }
        ordered.addAll(manifest.values());
        return ordered;
    }

    private static String read(ZipFile zip, String entryName, Path path) throws IOException {
        ZipEntry entry = zip.getEntry(entryName);
        if (entry == null) {
            throw new BookExtractionException(path, "EPUB entry missing (" + entryName + ")");
        }
        try (InputStream in = zip.getInputStream(entry)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
