package com.yizhaoqi.kb.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reduces an HTML page to its readable text: title, meta description and the main content area.
 */
@Component
public class HtmlContentNormalizer {

    private static final String[] REMOVE_SELECTORS = {"script", "style", "noscript"};

    // Main content areas, in priority order.
    private static final String[] CONTENT_SELECTORS = {
            "main",
            "article",
            "[role=main]",
            ".content",
            ".main-content",
            "#content"
    };

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern NEWLINE_RUN = Pattern.compile(" ?\\n[\\n ]*");

    public NormalizedPage normalize(String html) {
        Document doc = Jsoup.parse(html);
        for (String selector : REMOVE_SELECTORS) {
            doc.select(selector).remove();
        }

        String title = doc.title().trim();
        Element descriptionMeta = doc.selectFirst("meta[name=description]");
        String description = descriptionMeta != null ? descriptionMeta.attr("content").trim() : "";

        String body = collapseWhitespace(mainContent(doc));

        List<String> parts = new ArrayList<>();
        for (String part : new String[]{title, description, body}) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", title);
        metadata.put("description", description);
        return new NormalizedPage(String.join("\n\n", parts), metadata);
    }

    /**
     * Text of the first content selector that matches anything; body text when that is empty or nothing matches.
     */
    private String mainContent(Document doc) {
        for (String selector : CONTENT_SELECTORS) {
            Elements elements = doc.select(selector);
            if (!elements.isEmpty()) {
                String text = elements.stream().map(Element::wholeText).collect(Collectors.joining("\n"));
                if (!text.trim().isEmpty()) {
                    return text;
                }
                break;
            }
        }
        Element body = doc.body();
        return body != null ? body.wholeText() : "";
    }

    static String collapseWhitespace(String text) {
        String collapsed = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
        collapsed = NEWLINE_RUN.matcher(collapsed).replaceAll("\n");
        return collapsed.trim();
    }

    public record NormalizedPage(String text, Map<String, Object> metadata) {
    }
}
