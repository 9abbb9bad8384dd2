package com.williamcallahan.memorypipeline.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Groups markdown lines into blocks. Fenced code blocks and list items (with their indented
 * continuation lines) are atomic and must reach the aggregator unsplit.
 */
final class MarkdownBlockScanner {

    /** Minimum fence length for valid code fences (CommonMark requires 3). */
    static final int FENCE_MIN_LENGTH = 3;

    private static final int MAX_FENCE_INDENT = 3;
    private static final char BACKTICK = '`';
    private static final char TILDE = '~';
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s{0,3}(?:[-*+]|\\d{1,9}[.)])\\s+\\S");

    /**
     * A run of source lines.
     *
     * @param text lines joined with newlines
     * @param atomic true for code fences and list items
     */
    record Block(String text, boolean atomic) {}

    /**
     * Describes a detected fence marker.
     *
     * @param character the fence character (backtick or tilde)
     * @param length number of consecutive fence characters
     */
    record FenceMarker(char character, int length) {}

    private MarkdownBlockScanner() {}

    static List<Block> scan(String text) {
        String[] lines = text.split("\n", -1);
        List<Block> blocks = new ArrayList<>();
        StringBuilder paragraph = new StringBuilder();

        int index = 0;
        while (index < lines.length) {
            String line = lines[index];
            FenceMarker opening = scanFenceMarker(line);
            if (opening != null) {
                flush(paragraph, blocks);
                StringBuilder fence = new StringBuilder(line);
                index++;
                while (index < lines.length) {
                    String fenceLine = lines[index];
                    fence.append('\n').append(fenceLine);
                    index++;
                    if (closesFence(opening, fenceLine)) {
                        break;
                    }
                }
                blocks.add(new Block(fence.toString(), true));
                continue;
            }

            if (LIST_ITEM.matcher(line).find()) {
                flush(paragraph, blocks);
                StringBuilder item = new StringBuilder(line);
                index++;
                while (index < lines.length && isContinuation(lines[index])) {
                    item.append('\n').append(lines[index]);
                    index++;
                }
                blocks.add(new Block(item.toString(), true));
                continue;
            }

            if (line.isBlank()) {
                flush(paragraph, blocks);
            } else {
                if (paragraph.length() > 0) {
                    paragraph.append('\n');
                }
                paragraph.append(line);
            }
            index++;
        }
        flush(paragraph, blocks);
        return blocks;
    }

    /**
     * Scans for a fence marker (3+ backticks or tildes) at the start of a line.
     *
     * @return fence marker if found, null otherwise
     */
    static FenceMarker scanFenceMarker(String line) {
        int indent = 0;
        while (indent < line.length() && line.charAt(indent) == ' ') {
            indent++;
        }
        if (indent > MAX_FENCE_INDENT || indent >= line.length()) {
            return null;
        }
        char markerChar = line.charAt(indent);
        if (markerChar != BACKTICK && markerChar != TILDE) {
            return null;
        }
        int length = 0;
        while (indent + length < line.length() && line.charAt(indent + length) == markerChar) {
            length++;
        }
        return length >= FENCE_MIN_LENGTH ? new FenceMarker(markerChar, length) : null;
    }

    private static boolean closesFence(FenceMarker opening, String line) {
        FenceMarker marker = scanFenceMarker(line);
        return marker != null
                && marker.character() == opening.character()
                && marker.length() >= opening.length()
                && line.strip().length() == marker.length();
    }

    private static boolean isContinuation(String line) {
        return !line.isBlank() && Character.isWhitespace(line.charAt(0));
    }

    private static void flush(StringBuilder paragraph, List<Block> blocks) {
        if (paragraph.length() > 0) {
            blocks.add(new Block(paragraph.toString(), false));
            paragraph.setLength(0);
        }
    }
}
