package io.github.nicechester.scripture.store;

import java.io.IOException;

/**
 * A translation document could not be read or parsed.
 */
public class TranslationLoadException extends IOException {

    public TranslationLoadException(String message) {
        super(message);
    }

    public TranslationLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
