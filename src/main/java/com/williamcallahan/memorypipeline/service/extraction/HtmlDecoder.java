package com.williamcallahan.memorypipeline.service.extraction;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Extracts readable text from HTML, dropping navigation chrome and scripts.
 *
 * <p>The output is markdown-flavoured: code blocks become fences and list items keep a bullet marker, so
 * the chunker keeps them intact.
 */
@Component
@Order(20)
public class HtmlDecoder implements ContentDecoder {
    private static final int MIN_INLINE_TEXT_LENGTH = 20;
    private static final int MIN_FALLBACK_DIV_TEXT_LENGTH = 500;

    private static final List<String> REMOVE_SELECTORS = List.of(
            "nav", "header", "footer", "script", "style", "noscript", "iframe",
            ".navigation", ".nav", ".navbar", ".sidebar", ".toc", ".breadcrumb",
            ".skip-nav", ".skip-link", ".footer", ".header", ".copyright", ".legal",
            "#navigation", "#nav");

    private static final List<String> CONTENT_SELECTORS = List.of(
            "main", "article", ".content-container", ".main-content", ".documentation", ".doc-content", "#content");

    @Override
    public boolean supports(String mimeType) {
        String normalized = MimeTypes.normalize(mimeType);
        return MimeTypes.HTML.equals(normalized) || MimeTypes.XHTML.equals(normalized);
    }

    @Override
    public ExtractedContent decode(byte[] content, String mimeType) {
        return ExtractedContent.singleSection(MimeTypes.MARKDOWN, extractText(new String(content, StandardCharsets.UTF_8)));
    }

    /**
     * Parses the markup and returns its main content as text.
     */
    public String extractText(String html) {
        Document document = Jsoup.parse(html);
        for (String selector : REMOVE_SELECTORS) {
            document.select(selector).remove();
        }
        Element contentElement = findMainContent(document);
        if (contentElement == null) {
            contentElement = document.body();
        }
        if (contentElement == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        boolean structured = !contentElement.select("h1, h2, h3, h4, h5, h6, p, pre, ul, ol, table").isEmpty();
        if (structured) {
            contentElement.children().forEach(child -> appendBlock(child, text));
        } else {
            text.append(contentElement.text());
        }
        return collapseBlankLines(text.toString());
    }

    private Element findMainContent(Document document) {
        for (String selector : CONTENT_SELECTORS) {
            Elements elements = document.select(selector);
            if (!elements.isEmpty()) {
                return elements.stream()
                        .max(Comparator.comparingInt(element -> element.text().length()))
                        .orElse(elements.first());
            }
        }
        return document.select("div").stream()
                .filter(div -> div.text().length() > MIN_FALLBACK_DIV_TEXT_LENGTH && !isNavigation(div))
                .max(Comparator.comparingInt(div -> div.text().length()))
                .orElse(null);
    }

    private void appendBlock(Element element, StringBuilder text) {
        String elementText = element.text().trim();
        if (elementText.isEmpty() && !"pre".equals(element.tagName())) {
            return;
        }
        switch (element.tagName()) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> text.append("\n\n").append(elementText).append("\n\n");
            case "p", "blockquote" -> text.append(elementText).append("\n\n");
            case "pre" -> text.append("```\n").append(element.wholeText().strip()).append("\n```\n\n");
            case "ul", "ol" -> {
                appendListItems(element, text, 0);
                text.append("\n");
            }
            case "table" -> appendTable(element, text);
            case "div", "section", "main", "article" -> {
                if (isNavigation(element)) {
                    return;
                }
                if (element.children().isEmpty()) {
                    text.append(elementText).append("\n\n");
                } else {
                    element.children().forEach(child -> appendBlock(child, text));
                }
            }
            default -> {
                if (!isNavigation(element) && elementText.length() > MIN_INLINE_TEXT_LENGTH) {
                    text.append(elementText).append("\n\n");
                }
            }
        }
    }

    private void appendListItems(Element list, StringBuilder text, int depth) {
        for (Element item : list.children()) {
            if (!"li".equals(item.tagName())) {
                continue;
            }
            String itemText = item.ownText().trim();
            if (itemText.isEmpty()) {
                itemText = item.children().stream()
                        .filter(child -> !"ul".equals(child.tagName()) && !"ol".equals(child.tagName()))
                        .map(Element::text)
                        .collect(Collectors.joining(" "))
                        .trim();
            }
            if (!itemText.isEmpty()) {
                text.append("  ".repeat(depth)).append("- ").append(itemText).append("\n");
            }
            for (Element nested : item.select("> ul, > ol")) {
                appendListItems(nested, text, depth + 1);
            }
        }
    }

    private void appendTable(Element table, StringBuilder text) {
        for (Element row : table.select("tr")) {
            String rowText = row.select("td, th").stream().map(Element::text).collect(Collectors.joining(" | "));
            if (!rowText.isBlank()) {
                text.append(rowText).append("\n");
            }
        }
        text.append("\n");
    }

    private boolean isNavigation(Element element) {
        String className = element.className().toLowerCase(Locale.ROOT);
        String id = element.id().toLowerCase(Locale.ROOT);
        return className.contains("nav")
                || className.contains("menu")
                || className.contains("sidebar")
                || id.contains("nav")
                || id.contains("menu");
    }

    private static String collapseBlankLines(String text) {
        return text.replaceAll("[ \\t]+\\n", "\n").replaceAll("\\n{3,}", "\n\n").trim();
    }
}
