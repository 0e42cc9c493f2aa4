package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.ClassificationResult;
import io.github.nicechester.scripture.model.ScriptScan;
import io.github.nicechester.scripture.model.VocabularyMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether a passage is Hebrew, Aramaic or Greek.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>reference inside a known Aramaic passage and Hebrew script present → Aramaic (0.95)</li>
 *   <li>Imperial-Aramaic code points present → Aramaic</li>
 *   <li>Aramaic vocabulary confidence above 0.5 and Hebrew script present → Aramaic</li>
 *   <li>Hebrew script present → Hebrew</li>
 *   <li>Greek script present → Greek</li>
 *   <li>otherwise unknown (0.0)</li>
 * </ol>
 * Most Hebrew-script text in the Old Testament is Hebrew, so the weaker signals
 * sit below the reference and script checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LanguageClassifier {

    private static final double VOCABULARY_THRESHOLD = 0.5;

    private final ScriptClassifier scriptClassifier;
    private final PassageReferenceIndex passageReferenceIndex;
    private final VocabularyMatcher vocabularyMatcher;

    /**
     * Classify text with no verse reference.
     */
    public ClassificationResult classify(String text) {
        return classify(text, null, 0, 0);
    }

    /**
     * Classify text, using the verse reference when book is non-blank and
     * chapter and verse are positive. Null or empty text yields unknown.
     */
    public ClassificationResult classify(String text, String book, int chapter, int verse) {
        if (text == null || text.isEmpty()) {
            return ClassificationResult.unknown();
        }

        ScriptScan scan = scriptClassifier.scan(text);
        VocabularyMatch vocabulary = vocabularyMatcher.matchVocabulary(text);
        boolean referenceSupplied = book != null && !book.isBlank() && chapter > 0 && verse > 0;
        boolean knownAramaic = referenceSupplied && passageReferenceIndex.isAramaicPassage(book, chapter, verse);

        ClassificationResult result;
        if (knownAramaic && scan.hebrewCount() > 0) {
            result = ClassificationResult.knownAramaicPassage(scan, vocabulary);
        } else if (scan.imperialAramaicCount() > 0) {
            result = ClassificationResult.imperialAramaic(scan, vocabulary, knownAramaic);
        } else if (vocabulary.confidence() > VOCABULARY_THRESHOLD && scan.hebrewCount() > 0) {
            result = ClassificationResult.aramaicVocabulary(scan, vocabulary, knownAramaic);
        } else if (scan.hebrewCount() > 0) {
            result = ClassificationResult.hebrew(scan, vocabulary, knownAramaic);
        } else if (scan.greekCount() > 0) {
            result = ClassificationResult.greek(scan, vocabulary, knownAramaic);
        } else {
            result = ClassificationResult.unknown(scan, vocabulary, knownAramaic);
        }

        log.debug("Classified {} {}:{} as {} ({}) hebrew={}, greek={}, imperial={}, vocabulary={}",
            book, chapter, verse, result.language().code(), result.confidence(),
            scan.hebrewCount(), scan.greekCount(), scan.imperialAramaicCount(), vocabulary.words().size());
        return result;
    }
}
