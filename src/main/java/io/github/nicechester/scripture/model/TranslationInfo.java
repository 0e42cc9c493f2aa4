package io.github.nicechester.scripture.model;

/**
 * A translation or original-language corpus the resolver can load.
 *
 * @param id                     translation id (e.g. "kjv", "jps", "hebrew-ot")
 * @param name                   display name
 * @param abbreviation           short label
 * @param file                   document name, resolved against the data base path
 * @param followsSourceNumbering true when the translation numbers verses the
 *                               way the source-language text does (Psalm
 *                               superscriptions counted as verses)
 */
public record TranslationInfo(
    String id,
    String name,
    String abbreviation,
    String file,
    boolean followsSourceNumbering
) {
    public TranslationInfo withSourceNumbering(boolean follows) {
        return new TranslationInfo(id, name, abbreviation, file, follows);
    }
}
