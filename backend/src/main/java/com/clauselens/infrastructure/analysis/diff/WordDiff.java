package com.clauselens.infrastructure.analysis.diff;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level diff of two texts.
 *
 * Words and punctuation marks are the diff units; the whitespace that follows a unit travels
 * with it but is ignored when units are compared. Units are aligned by longest common
 * subsequence and consecutive units with the same operation are merged into one segment.
 * When the alignment table would exceed {@link #MAX_TABLE_CELLS} the texts are diffed
 * sentence by sentence instead. If the sentence table is still too large, everything between
 * the common prefix and suffix becomes one delete followed by one insert.
 */
@Component
public class WordDiff {

    static final long MAX_TABLE_CELLS = 4_000_000L;

    private static final Pattern WORD_UNITS = Pattern.compile(
            "[\\p{L}\\p{N}_]+\\s*|[^\\p{L}\\p{N}_\\s]\\s*|\\s+");

    private static final Pattern SENTENCE_UNITS = Pattern.compile(
            "[^.!?;\\n]+[.!?;\\n]*\\s*|[.!?;\\n]+\\s*");

    public enum Operation {
        EQUAL,
        INSERT,
        DELETE
    }

    public record Segment(Operation operation, String text) {}

    public List<Segment> diff(String source, String target) {
        List<String> sourceUnits = split(source, WORD_UNITS);
        List<String> targetUnits = split(target, WORD_UNITS);

        if (tableCells(sourceUnits, targetUnits) > MAX_TABLE_CELLS) {
            sourceUnits = split(source, SENTENCE_UNITS);
            targetUnits = split(target, SENTENCE_UNITS);
        }
        return align(sourceUnits, targetUnits);
    }

    /**
     * Share of characters that were inserted or deleted, over all diffed characters.
     */
    public static double changeRatio(List<Segment> segments) {
        long total = 0;
        long changed = 0;
        for (Segment segment : segments) {
            total += segment.text().length();
            if (segment.operation() != Operation.EQUAL) {
                changed += segment.text().length();
            }
        }
        return total > 0 ? (double) changed / total : 0.0;
    }

    private List<Segment> align(List<String> a, List<String> b) {
        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && sameUnit(a.get(prefix), b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && sameUnit(a.get(a.size() - 1 - suffix), b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        SegmentBuilder out = new SegmentBuilder();
        for (int i = 0; i < prefix; i++) {
            out.add(Operation.EQUAL, a.get(i));
        }

        List<String> midA = a.subList(prefix, a.size() - suffix);
        List<String> midB = b.subList(prefix, b.size() - suffix);
        if (tableCells(midA, midB) > MAX_TABLE_CELLS) {
            midA.forEach(unit -> out.add(Operation.DELETE, unit));
            midB.forEach(unit -> out.add(Operation.INSERT, unit));
        } else {
            alignByLcs(midA, midB, out);
        }

        for (int k = a.size() - suffix; k < a.size(); k++) {
            out.add(Operation.EQUAL, a.get(k));
        }
        return out.build();
    }

    private static void alignByLcs(List<String> a, List<String> b, SegmentBuilder out) {
        int n = a.size();
        int m = b.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = sameUnit(a.get(i), b.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (sameUnit(a.get(i), b.get(j))) {
                out.add(Operation.EQUAL, a.get(i));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                out.add(Operation.DELETE, a.get(i++));
            } else {
                out.add(Operation.INSERT, b.get(j++));
            }
        }
        while (i < n) {
            out.add(Operation.DELETE, a.get(i++));
        }
        while (j < m) {
            out.add(Operation.INSERT, b.get(j++));
        }
    }

    private static boolean sameUnit(String left, String right) {
        return left.strip().equals(right.strip());
    }

    private static long tableCells(List<String> a, List<String> b) {
        return (long) (a.size() + 1) * (b.size() + 1);
    }

    private static List<String> split(String text, Pattern pattern) {
        List<String> units = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return units;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            units.add(matcher.group());
        }
        return units;
    }

    private static final class SegmentBuilder {
        private final List<Segment> segments = new ArrayList<>();
        private Operation current;
        private final StringBuilder buffer = new StringBuilder();

        void add(Operation operation, String text) {
            if (operation != current && current != null) {
                flush();
            }
            current = operation;
            buffer.append(text);
        }

        List<Segment> build() {
            if (current != null) {
                flush();
            }
            return segments;
        }

        private void flush() {
            segments.add(new Segment(current, buffer.toString()));
            buffer.setLength(0);
        }
    }
}
