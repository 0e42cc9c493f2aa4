package io.github.nicechester.scripture.model;

import java.util.List;

/**
 * Aramaic vocabulary hits found in a text.
 *
 * @param found      true when at least one entry matched
 * @param words      matched entries, in vocabulary order
 * @param confidence saturating score in [0, 1]
 */
public record VocabularyMatch(boolean found, List<String> words, double confidence) {

    public VocabularyMatch {
        words = List.copyOf(words);
    }

    public static VocabularyMatch none() {
        return new VocabularyMatch(false, List.of(), 0.0);
    }
}
