package com.williamcallahan.memorypipeline.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Splits extracted text into size-bounded, overlap-aware partitions.
 *
 * <p>Works in two phases. Line splitting breaks text into sentence-respecting lines of at most
 * {@code maxTokensPerLine} tokens, cutting oversized text at the highest-priority separator closest to
 * its middle. Paragraph aggregation then packs consecutive lines greedily and prefixes each partition
 * with the tail of the previous one. Content is never dropped: a line that is too large on its own
 * becomes its own partition.
 */
@Component
public class Chunker {
    private static final String OVERLAP_JOINER = "\n";

    private final TokenCounter tokenCounter;

    public Chunker(TokenCounter tokenCounter) {
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
    }

    /**
     * Partitions a single text.
     *
     * @return partition texts in order; empty for blank input
     */
    public List<String> split(String text, ChunkerOptions options, TextFormat format) {
        return splitPages(List.of(text == null ? "" : text), options, format, false).stream()
                .map(TextPartition::text)
                .toList();
    }

    /**
     * Partitions text that arrives in pages.
     *
     * @param pages page texts, page 1 first
     * @param pagesEndSentences when true no partition mixes lines from two pages and no overlap is
     *     carried across a page break
     * @return partitions in order; empty when every page is blank
     */
    public List<TextPartition> splitPages(
            List<String> pages, ChunkerOptions options, TextFormat format, boolean pagesEndSentences) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(format, "format");

        List<Line> lines = new ArrayList<>();
        for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
            String page = pages.get(pageIndex);
            if (page == null || page.isBlank()) {
                continue;
            }
            for (Line line : splitLines(page, options.maxTokensPerLine(), format)) {
                lines.add(new Line(line.text(), line.startsBlock(), pageIndex + 1));
            }
        }

        List<Paragraph> paragraphs = aggregate(lines, options, pagesEndSentences);
        return applyOverlap(paragraphs, options.overlapTokens(), pagesEndSentences);
    }

    /**
     * Phase one: sentence-respecting lines bounded by {@code maxTokensPerLine}. Markdown code fences
     * and list items are emitted whole even when they exceed the bound.
     */
    public List<Line> splitLines(String text, int maxTokensPerLine, TextFormat format) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<Line> lines = new ArrayList<>();

        if (format == TextFormat.MARKDOWN) {
            for (MarkdownBlockScanner.Block block : MarkdownBlockScanner.scan(normalized)) {
                if (block.atomic()) {
                    lines.add(new Line(block.text(), true, 1));
                } else {
                    splitBlock(block.text(), maxTokensPerLine, format, lines);
                }
            }
        } else {
            for (String sourceLine : normalized.split("\n")) {
                if (!sourceLine.isBlank()) {
                    splitBlock(sourceLine, maxTokensPerLine, format, lines);
                }
            }
        }
        return lines;
    }

    public int countTokens(String text) {
        return tokenCounter.countTokens(text);
    }

    private void splitBlock(String block, int maxTokens, TextFormat format, List<Line> out) {
        List<String> fragments = new ArrayList<>();
        splitToFit(block, maxTokens, format.separators(), fragments);
        boolean first = true;
        for (String fragment : fragments) {
            out.add(new Line(fragment, first, 1));
            first = false;
        }
    }

    // Fragments keep their surrounding whitespace so concatenating them restores the block.
    private void splitToFit(String text, int maxTokens, List<String> separators, List<String> out) {
        if (text.isBlank()) {
            return;
        }
        if (text.codePointCount(0, text.length()) <= 1 || tokenCounter.countTokens(text) <= maxTokens) {
            out.add(text);
            return;
        }
        int cut = findCutPoint(text, separators);
        splitToFit(text.substring(0, cut), maxTokens, separators, out);
        splitToFit(text.substring(cut), maxTokens, separators, out);
    }

    /**
     * Position right after the separator closest to the middle, trying separator groups in priority
     * order. Falls back to the middle of the text. Always strictly inside the text.
     */
    static int findCutPoint(String text, List<String> separators) {
        int length = text.length();
        int middle = length / 2;
        for (String group : separators) {
            int best = -1;
            for (int index = 0; index < length; index++) {
                if (group.indexOf(text.charAt(index)) < 0) {
                    continue;
                }
                int cut = index + 1;
                if (cut >= length) {
                    continue;
                }
                if (best < 0 || Math.abs(cut - middle) < Math.abs(best - middle)) {
                    best = cut;
                }
            }
            if (best > 0) {
                return best;
            }
        }
        int cut = Math.max(1, middle);
        if (cut < length && Character.isLowSurrogate(text.charAt(cut))) {
            cut = cut + 1 < length ? cut + 1 : cut - 1;
        }
        return cut;
    }

    private List<Paragraph> aggregate(List<Line> lines, ChunkerOptions options, boolean pagesEndSentences) {
        int budget = options.maxTokensPerParagraph() - options.overlapTokens();
        List<Paragraph> paragraphs = new ArrayList<>();
        StringBuilder current = null;
        int currentPage = 0;

        for (Line line : lines) {
            if (current == null) {
                current = new StringBuilder(line.text());
                currentPage = line.page();
                continue;
            }
            if (pagesEndSentences && line.page() != currentPage) {
                addParagraph(paragraphs, current, currentPage);
                current = new StringBuilder(line.text());
                currentPage = line.page();
                continue;
            }
            String candidate = current + (line.startsBlock() ? "\n" : "") + line.text();
            if (tokenCounter.countTokens(candidate.strip()) <= budget) {
                current = new StringBuilder(candidate);
            } else {
                addParagraph(paragraphs, current, currentPage);
                current = new StringBuilder(line.text());
                currentPage = line.page();
            }
        }
        if (current != null) {
            addParagraph(paragraphs, current, currentPage);
        }
        return paragraphs;
    }

    private static void addParagraph(List<Paragraph> paragraphs, StringBuilder text, int page) {
        String stripped = text.toString().strip();
        if (!stripped.isEmpty()) {
            paragraphs.add(new Paragraph(stripped, page));
        }
    }

    private List<TextPartition> applyOverlap(List<Paragraph> paragraphs, int overlapTokens, boolean pagesEndSentences) {
        List<TextPartition> partitions = new ArrayList<>(paragraphs.size());
        TextPartition previous = null;
        for (Paragraph paragraph : paragraphs) {
            String text = paragraph.text();
            boolean crossesPage = previous != null && previous.pageNumber() != paragraph.page();
            if (previous != null && overlapTokens > 0 && !(pagesEndSentences && crossesPage)) {
                String tail = overlapTail(previous.text(), overlapTokens);
                if (!tail.isEmpty()) {
                    text = tail + OVERLAP_JOINER + text;
                }
            }
            TextPartition partition = new TextPartition(partitions.size(), paragraph.page(), text);
            partitions.add(partition);
            previous = partition;
        }
        return partitions;
    }

    /**
     * Longest proper suffix starting at a word boundary with at most {@code overlapTokens} tokens.
     */
    String overlapTail(String text, int overlapTokens) {
        String best = "";
        for (int index = text.length() - 1; index > 0; index--) {
            if (!Character.isWhitespace(text.charAt(index - 1)) || Character.isWhitespace(text.charAt(index))) {
                continue;
            }
            String candidate = text.substring(index);
            if (tokenCounter.countTokens(candidate) > overlapTokens) {
                break;
            }
            best = candidate;
        }
        return best;
    }

    /**
     * A sentence-respecting line.
     *
     * @param text line text, surrounding whitespace preserved
     * @param startsBlock true when the line starts a new source line or markdown block
     * @param page 1-based page the line came from
     */
    public record Line(String text, boolean startsBlock, int page) {}

    private record Paragraph(String text, int page) {}
}
