package com.librarian.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

public interface BookExtractor {
    List<String> extensions();

    Document extract(Path path) throws IOException;

    default boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions().stream().anyMatch(fileName::endsWith);
    }

    static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return Whitespace.RUNS.matcher(text).replaceAll(" ").strip();
    }

    static String textOf(Element root) {
        StringBuilder builder = new StringBuilder();
        root.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                builder.append(((TextNode) node).getWholeText()).append(' ');
            }
        });
        return builder.toString();
    }

    final class Whitespace {
        static final Pattern RUNS = Pattern.compile("\\s+");

        private Whitespace() {
        }
    }
}
