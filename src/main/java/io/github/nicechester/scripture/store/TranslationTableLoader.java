package io.github.nicechester.scripture.store;

import io.github.nicechester.scripture.model.TranslationInfo;
import io.github.nicechester.scripture.model.TranslationTable;

/**
 * Turns a translation document into a {@link TranslationTable}.
 * Called from loader threads; implementations must be thread-safe.
 */
public interface TranslationTableLoader {

    TranslationTable load(TranslationInfo translation) throws TranslationLoadException;
}
