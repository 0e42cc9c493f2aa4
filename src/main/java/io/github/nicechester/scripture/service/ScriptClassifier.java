package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.ScriptBlock;
import io.github.nicechester.scripture.model.ScriptScan;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PrimitiveIterator;

/**
 * Buckets the code points of a text into Hebrew, Greek and Imperial-Aramaic runs.
 *
 * <p>A run is a maximal sequence of code points from the same {@link ScriptBlock};
 * any code point outside that block (space, punctuation, Latin, another script)
 * ends it. Runs are reported in logical (stream) order, independent of the
 * right-to-left display direction of Hebrew.
 */
@Service
public class ScriptClassifier {

    public ScriptScan scan(String text) {
        if (text == null || text.isEmpty()) {
            return ScriptScan.empty();
        }

        Map<ScriptBlock, List<String>> runs = new EnumMap<>(ScriptBlock.class);
        for (ScriptBlock block : ScriptBlock.values()) {
            runs.put(block, new ArrayList<>());
        }

        StringBuilder run = new StringBuilder();
        ScriptBlock current = null;
        PrimitiveIterator.OfInt codePoints = text.codePoints().iterator();
        while (codePoints.hasNext()) {
            int codePoint = codePoints.nextInt();
            ScriptBlock block = ScriptBlock.of(codePoint);
            if (block != current) {
                flush(runs, current, run);
                current = block;
            }
            if (block != null) {
                run.appendCodePoint(codePoint);
            }
        }
        flush(runs, current, run);

        return new ScriptScan(
            runs.get(ScriptBlock.HEBREW),
            runs.get(ScriptBlock.GREEK),
            runs.get(ScriptBlock.IMPERIAL_ARAMAIC)
        );
    }

    public boolean hasHebrew(String text) {
        return containsBlock(text, ScriptBlock.HEBREW);
    }

    public boolean hasGreek(String text) {
        return containsBlock(text, ScriptBlock.GREEK);
    }

    public boolean hasImperialAramaic(String text) {
        return containsBlock(text, ScriptBlock.IMPERIAL_ARAMAIC);
    }

    /**
     * Hebrew runs joined by single spaces.
     */
    public String extractHebrew(String text) {
        return String.join(" ", scan(text).hebrewMatches());
    }

    /**
     * Greek runs joined by single spaces.
     */
    public String extractGreek(String text) {
        return String.join(" ", scan(text).greekMatches());
    }

    /**
     * Hebrew plus Imperial-Aramaic runs when Imperial-Aramaic code points are
     * present. Hebrew square script alone is not evidence of Aramaic, so
     * without them the result is empty.
     */
    public String extractAramaic(String text) {
        ScriptScan scan = scan(text);
        if (scan.imperialAramaicCount() == 0) {
            return "";
        }
        List<String> parts = new ArrayList<>(scan.hebrewMatches());
        parts.addAll(scan.imperialAramaicMatches());
        return String.join(" ", parts);
    }

    private static boolean containsBlock(String text, ScriptBlock block) {
        return text != null && text.codePoints().anyMatch(block::contains);
    }

    private static void flush(Map<ScriptBlock, List<String>> runs, ScriptBlock block, StringBuilder run) {
        if (block != null && run.length() > 0) {
            runs.get(block).add(run.toString());
        }
        run.setLength(0);
    }
}
