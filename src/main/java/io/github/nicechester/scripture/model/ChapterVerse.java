package io.github.nicechester.scripture.model;

import lombok.Builder;
import lombok.Data;

/**
 * One logical verse of a parallel chapter view.
 */
@Data
@Builder(toBuilder = true)
public class ChapterVerse {

    /**
     * Logical verse number (reference translation numbering)
     */
    private int verse;

    /**
     * Verse number read from the source-language text
     */
    private int sourceVerse;

    /**
     * Hebrew or Greek text, empty when missing
     */
    private String originalText;

    /**
     * Text of the requested translation, or of the reference translation
     * when the requested one lacks the verse
     */
    private String translationText;

    /**
     * True when translationText came from the reference translation
     */
    private boolean fallback;

    /**
     * Language detected for originalText
     */
    private DetectedLanguage language;

    /**
     * Source-language superscription, only set on logical verse 1
     */
    private String superscription;

    public boolean hasSuperscription() {
        return superscription != null && !superscription.isEmpty();
    }
}
