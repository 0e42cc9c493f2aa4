package io.github.nicechester.scripture.model;

import java.util.List;

/**
 * Runs of same-block code points found in a text, each list in left-to-right
 * stream order.
 */
public record ScriptScan(
    List<String> hebrewMatches,
    List<String> greekMatches,
    List<String> imperialAramaicMatches
) {

    public ScriptScan {
        hebrewMatches = List.copyOf(hebrewMatches);
        greekMatches = List.copyOf(greekMatches);
        imperialAramaicMatches = List.copyOf(imperialAramaicMatches);
    }

    public static ScriptScan empty() {
        return new ScriptScan(List.of(), List.of(), List.of());
    }

    public int hebrewCount() {
        return hebrewMatches.size();
    }

    public int greekCount() {
        return greekMatches.size();
    }

    public int imperialAramaicCount() {
        return imperialAramaicMatches.size();
    }

    public boolean isEmpty() {
        return hebrewMatches.isEmpty() && greekMatches.isEmpty() && imperialAramaicMatches.isEmpty();
    }
}
