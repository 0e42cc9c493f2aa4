package io.github.nicechester.scripture.model;

import java.util.Locale;

public enum DetectedLanguage {
    HEBREW,
    GREEK,
    ARAMAIC,
    UNKNOWN;

    /**
     * Lowercase code used by badge rendering ("hebrew", "greek", ...).
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
