package io.github.nicechester.scripture.model;

import java.util.List;

/**
 * Parallel rendering of a chapter: original text beside one translation,
 * numbered by the reference translation.
 */
public record ChapterView(
    String bookId,
    int chapter,
    String translationId,
    State state,
    int offset,
    List<ChapterVerse> verses
) {

    public enum State {
        /** All tables present, verses populated */
        READY,
        /** A required table is still loading; verses empty */
        LOADING,
        /** A required table failed to load; verses empty */
        LOAD_FAILED,
        /** Book not in the catalog or chapter absent from the reference translation */
        NOT_FOUND
    }

    public ChapterView {
        verses = List.copyOf(verses);
    }

    public static ChapterView pending(String bookId, int chapter, String translationId, State state) {
        return new ChapterView(bookId, chapter, translationId, state, 0, List.of());
    }

    public boolean isReady() {
        return state == State.READY;
    }
}
