package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.VocabularyMatch;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks for function words and morphemes that mark a Hebrew-script passage as Aramaic.
 *
 * <p>Matching is literal substring search; no diacritic stripping. Each entry is
 * listed both vocalised and unvocalised.
 */
@Service
public class VocabularyMatcher {

    /**
     * Distinct hits at which the score saturates at 1.0. Tunable heuristic.
     */
    public static final int SATURATION_MATCHES = 3;

    private static final List<String> ARAMAIC_VOCABULARY = List.of(
        "דִּי", "די",         // di, "that/which" (Hebrew uses asher)
        "מַלְכָּא", "מלכא",   // malka, "the king", emphatic state
        "אֱלָהּ", "אלה",      // elah, "God" (Hebrew elohim)
        "קֳדָם", "קדם",       // qodam, "before"
        "כְּעַן", "כען",      // ke'an, "now" (Hebrew attah)
        "הֲוָא", "הוא"        // hava, "was" (Hebrew hayah)
    );

    public VocabularyMatch matchVocabulary(String text) {
        if (text == null || text.isEmpty()) {
            return VocabularyMatch.none();
        }

        List<String> matched = new ArrayList<>();
        for (String word : ARAMAIC_VOCABULARY) {
            if (text.contains(word)) {
                matched.add(word);
            }
        }
        if (matched.isEmpty()) {
            return VocabularyMatch.none();
        }

        double confidence = Math.min((double) matched.size() / SATURATION_MATCHES, 1.0);
        return new VocabularyMatch(true, matched, confidence);
    }

    public List<String> vocabulary() {
        return ARAMAIC_VOCABULARY;
    }
}
