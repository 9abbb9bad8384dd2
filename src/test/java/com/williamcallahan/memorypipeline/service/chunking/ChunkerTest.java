package com.williamcallahan.memorypipeline.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

/**
 * Verifies line splitting, paragraph aggregation and overlap with a whitespace token counter.
 */
class ChunkerTest {

    private static final TokenCounter WORDS = text -> {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    };

    private final Chunker chunker = new Chunker(WORDS);

    @Test
    void blankTextProducesNoPartitions() {
        assertTrue(chunker.split("   \n\n ", new ChunkerOptions(10, 30, 5), TextFormat.PLAIN_TEXT).isEmpty());
    }

    @Test
    void smallDocumentFitsInOnePartition() {
        String text = words(50) + ".";

        List<String> partitions = chunker.split(text, new ChunkerOptions(300, 2000, 30), TextFormat.PLAIN_TEXT);

        assertEquals(List.of(text), partitions);
    }

    @Test
    void partitionsStayWithinParagraphBudget() {
        ChunkerOptions options = new ChunkerOptions(10, 30, 5);

        List<String> partitions = chunker.split(words(200), options, TextFormat.PLAIN_TEXT);

        assertTrue(partitions.size() > 1);
        for (String partition : partitions) {
            assertTrue(WORDS.countTokens(partition) <= options.maxTokensPerParagraph(),
                    "Partition too large: " + partition);
        }
    }

    @Test
    void eachPartitionStartsWithTheTailOfThePreviousOne() {
        List<String> partitions = chunker.split(words(200), new ChunkerOptions(10, 30, 5), TextFormat.PLAIN_TEXT);

        for (int index = 1; index < partitions.size(); index++) {
            String overlap = partitions.get(index).split("\n", 2)[0];
            assertFalse(overlap.isBlank());
            assertTrue(WORDS.countTokens(overlap) <= 5);
            assertTrue(partitions.get(index - 1).endsWith(overlap),
                    "Partition " + index + " does not repeat the end of partition " + (index - 1));
        }
    }

    @Test
    void noContentIsDroppedWithoutOverlap() {
        String text = words(137);

        List<String> partitions = chunker.split(text, new ChunkerOptions(7, 20, 0), TextFormat.PLAIN_TEXT);

        List<String> rejoined = new ArrayList<>();
        for (String partition : partitions) {
            rejoined.addAll(Arrays.asList(partition.strip().split("\\s+")));
        }
        assertEquals(Arrays.asList(text.split("\\s+")), rejoined);
    }

    @Test
    void pagesThatEndSentencesAreNeverMixed() {
        List<TextPartition> partitions = chunker.splitPages(
                List.of("Alpha beta gamma.", "Delta epsilon."), new ChunkerOptions(10, 100, 5),
                TextFormat.PLAIN_TEXT, true);

        assertEquals(2, partitions.size());
        assertEquals(1, partitions.get(0).pageNumber());
        assertEquals(2, partitions.get(1).pageNumber());
        assertEquals("Delta epsilon.", partitions.get(1).text());
    }

    @Test
    void pagesThatDoNotEndSentencesAreMerged() {
        List<TextPartition> partitions = chunker.splitPages(
                List.of("Alpha beta gamma", "delta epsilon."), new ChunkerOptions(10, 100, 5),
                TextFormat.PLAIN_TEXT, false);

        assertEquals(1, partitions.size());
        assertTrue(partitions.get(0).text().contains("gamma"));
        assertTrue(partitions.get(0).text().contains("delta"));
    }

    @Test
    void markdownCodeFenceIsKeptWhole() {
        String fence = "```java\n" + words(25) + "\n```";
        String markdown = "Intro paragraph.\n\n" + fence + "\n\nOutro paragraph.";

        List<String> partitions = chunker.split(markdown, new ChunkerOptions(5, 60, 0), TextFormat.MARKDOWN);

        assertTrue(partitions.stream().anyMatch(partition -> partition.contains(fence)), partitions.toString());
    }

    @Test
    void markdownListItemKeepsItsContinuationLines() {
        String item = "- " + words(12) + "\n  " + words(8);
        String markdown = "Intro paragraph.\n\n" + item + "\n- short item\n\nOutro paragraph.";

        List<String> lines = chunker.splitLines(markdown, 5, TextFormat.MARKDOWN).stream()
                .map(Chunker.Line::text)
                .toList();

        assertTrue(lines.contains(item), lines.toString());
        assertTrue(lines.contains("- short item"), lines.toString());
    }

    @Test
    void oversizedCodeFenceBecomesExactlyOnePartition() {
        String fence = "```\n" + words(80) + "\n```";
        String markdown = "Intro paragraph.\n\n" + fence + "\n\nOutro paragraph.";

        List<String> partitions = chunker.split(markdown, new ChunkerOptions(5, 30, 0), TextFormat.MARKDOWN);

        assertEquals(List.of("Intro paragraph.", fence, "Outro paragraph."), partitions);
    }

    @Test
    void oversizedListItemBecomesExactlyOnePartition() {
        String item = "1. " + words(40) + "\n   " + words(10);

        List<String> partitions = chunker.split(item, new ChunkerOptions(5, 30, 0), TextFormat.MARKDOWN);

        assertEquals(List.of(item), partitions);
    }

    @Test
    void cutPointPrefersSentenceBoundaryNearestTheMiddle() {
        String text = "One two. Three four. Five six.";

        int cut = Chunker.findCutPoint(text, TextFormat.PLAIN_TEXT.separators());

        assertEquals("One two. Three four.", text.substring(0, cut));
    }

    @Test
    void rejectsOverlapAsLargeAsTheParagraph() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkerOptions(10, 30, 30));
    }

    private static String words(int count) {
        return IntStream.range(0, count).mapToObj(index -> "w" + index).collect(Collectors.joining(" "));
    }
}
