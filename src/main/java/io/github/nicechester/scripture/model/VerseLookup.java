package io.github.nicechester.scripture.model;

import java.util.Optional;

/**
 * Answer to a single verse request against one translation.
 * Absence is reported through {@link Status}, never through an exception.
 */
public record VerseLookup(
    Status status,
    String translationId,
    String bookId,
    int chapter,
    int verse,
    String text
) {

    public enum Status {
        /** Text found */
        FOUND,
        /** Translation not loaded yet; ask again once the load completes */
        LOADING,
        /** Translation loaded but has no text for this verse */
        VERSE_NOT_FOUND,
        /** Loading the translation failed; stays so until a retry succeeds */
        LOAD_FAILED,
        /** Translation id is not in the catalog */
        UNKNOWN_TRANSLATION
    }

    public static VerseLookup found(String translationId, String bookId, int chapter, int verse, String text) {
        return new VerseLookup(Status.FOUND, translationId, bookId, chapter, verse, text);
    }

    public static VerseLookup absent(Status status, String translationId, String bookId, int chapter, int verse) {
        if (status == Status.FOUND) {
            throw new IllegalArgumentException("FOUND lookups need a text");
        }
        return new VerseLookup(status, translationId, bookId, chapter, verse, null);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isPending() {
        return status == Status.LOADING;
    }

    public Optional<String> textIfFound() {
        return Optional.ofNullable(text);
    }
}
