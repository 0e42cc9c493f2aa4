package io.github.nicechester.scripture.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of classifying one passage.
 *
 * <p>Instances are only built through the static factories, each of which
 * derives the confidence from the scan and vocabulary evidence it is given:
 * <ul>
 *   <li>{@link #knownAramaicPassage}: fixed 0.95, canonical reference confirmed</li>
 *   <li>{@link #imperialAramaic}: imperial runs / all runs</li>
 *   <li>{@link #aramaicVocabulary}: vocabulary confidence</li>
 *   <li>{@link #hebrew}, {@link #greek}: share of Hebrew vs Greek runs</li>
 * </ul>
 */
public record ClassificationResult(
    DetectedLanguage language,

    /**
     * Confidence in [0, 1]
     */
    double confidence,

    /**
     * Script runs that justify the language, in stream order
     */
    List<String> matches,

    /**
     * Raw run counts per script
     */
    Counts counts,

    /**
     * Aramaic vocabulary hits, whatever rule decided the language
     */
    List<String> aramaicWords,

    /**
     * Whether the supplied reference lies in a registered Aramaic passage
     */
    boolean knownAramaicPassage
) {

    /** Confidence granted when a canonical reference confirms Aramaic. */
    public static final double REFERENCE_CONFIDENCE = 0.95;

    /**
     * Run counts. {@code aramaic} counts Imperial-Aramaic runs only.
     */
    public record Counts(int hebrew, int greek, int aramaic) {

        public static Counts of(ScriptScan scan) {
            return new Counts(scan.hebrewCount(), scan.greekCount(), scan.imperialAramaicCount());
        }

        public int total() {
            return hebrew + greek + aramaic;
        }
    }

    public ClassificationResult {
        matches = List.copyOf(matches);
        aramaicWords = List.copyOf(aramaicWords);
    }

    public static ClassificationResult unknown() {
        return new ClassificationResult(DetectedLanguage.UNKNOWN, 0.0, List.of(),
            new Counts(0, 0, 0), List.of(), false);
    }

    public static ClassificationResult unknown(ScriptScan scan, VocabularyMatch vocabulary, boolean knownPassage) {
        return new ClassificationResult(DetectedLanguage.UNKNOWN, 0.0, List.of(),
            Counts.of(scan), vocabulary.words(), knownPassage);
    }

    public static ClassificationResult knownAramaicPassage(ScriptScan scan, VocabularyMatch vocabulary) {
        return new ClassificationResult(DetectedLanguage.ARAMAIC, REFERENCE_CONFIDENCE,
            scan.hebrewMatches(), Counts.of(scan), vocabulary.words(), true);
    }

    public static ClassificationResult imperialAramaic(ScriptScan scan, VocabularyMatch vocabulary, boolean knownPassage) {
        Counts counts = Counts.of(scan);
        List<String> matches = new ArrayList<>(scan.hebrewMatches());
        matches.addAll(scan.imperialAramaicMatches());
        double confidence = (double) counts.aramaic() / counts.total();
        return new ClassificationResult(DetectedLanguage.ARAMAIC, confidence,
            matches, counts, vocabulary.words(), knownPassage);
    }

    public static ClassificationResult aramaicVocabulary(ScriptScan scan, VocabularyMatch vocabulary, boolean knownPassage) {
        return new ClassificationResult(DetectedLanguage.ARAMAIC, vocabulary.confidence(),
            scan.hebrewMatches(), Counts.of(scan), vocabulary.words(), knownPassage);
    }

    public static ClassificationResult hebrew(ScriptScan scan, VocabularyMatch vocabulary, boolean knownPassage) {
        Counts counts = Counts.of(scan);
        int total = counts.hebrew() + counts.greek();
        double confidence = total > 0 ? (double) counts.hebrew() / total : 1.0;
        return new ClassificationResult(DetectedLanguage.HEBREW, confidence,
            scan.hebrewMatches(), counts, vocabulary.words(), knownPassage);
    }

    public static ClassificationResult greek(ScriptScan scan, VocabularyMatch vocabulary, boolean knownPassage) {
        Counts counts = Counts.of(scan);
        int total = counts.hebrew() + counts.greek();
        double confidence = total > 0 ? (double) counts.greek() / total : 1.0;
        return new ClassificationResult(DetectedLanguage.GREEK, confidence,
            scan.greekMatches(), counts, vocabulary.words(), knownPassage);
    }

    public boolean isAramaic() {
        return language == DetectedLanguage.ARAMAIC;
    }
}
