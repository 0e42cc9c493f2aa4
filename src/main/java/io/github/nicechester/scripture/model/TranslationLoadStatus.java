package io.github.nicechester.scripture.model;

/**
 * Pollable load state of one translation.
 */
public record TranslationLoadStatus(
    String translationId,
    State state,
    TranslationTable table,
    String error
) {

    public enum State {
        NOT_LOADED,
        LOADING,
        LOADED,
        FAILED
    }

    public static TranslationLoadStatus notLoaded(String translationId) {
        return new TranslationLoadStatus(translationId, State.NOT_LOADED, null, null);
    }

    public static TranslationLoadStatus loading(String translationId) {
        return new TranslationLoadStatus(translationId, State.LOADING, null, null);
    }

    public static TranslationLoadStatus loaded(TranslationTable table) {
        return new TranslationLoadStatus(table.translationId(), State.LOADED, table, null);
    }

    public static TranslationLoadStatus failed(String translationId, String error) {
        return new TranslationLoadStatus(translationId, State.FAILED, null, error);
    }

    public boolean isLoaded() {
        return state == State.LOADED;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }
}
