package io.github.nicechester.scripture.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Verse texts of one translation, keyed book id → chapter → verse.
 * Immutable once built; safe to share between threads.
 */
public final class TranslationTable {

    private final String translationId;
    private final Map<String, NavigableMap<Integer, NavigableMap<Integer, String>>> books;
    private final int verseCount;

    private TranslationTable(String translationId,
                             Map<String, NavigableMap<Integer, NavigableMap<Integer, String>>> books,
                             int verseCount) {
        this.translationId = translationId;
        this.books = books;
        this.verseCount = verseCount;
    }

    public static Builder builder(String translationId) {
        return new Builder(translationId);
    }

    public String translationId() {
        return translationId;
    }

    public Optional<String> verse(String bookId, int chapter, int verse) {
        return Optional.ofNullable(chapter(bookId, chapter).get(verse));
    }

    /**
     * Verses of one chapter in ascending order; empty when absent.
     */
    public NavigableMap<Integer, String> chapter(String bookId, int chapter) {
        NavigableMap<Integer, NavigableMap<Integer, String>> chapters = books.get(bookId);
        if (chapters == null) {
            return Collections.emptyNavigableMap();
        }
        NavigableMap<Integer, String> verses = chapters.get(chapter);
        return verses != null ? verses : Collections.emptyNavigableMap();
    }

    public int verseCount(String bookId, int chapter) {
        return chapter(bookId, chapter).size();
    }

    /**
     * Highest verse number present in a chapter, 0 when absent. Differs from
     * {@link #verseCount(String, int)} when the chapter has gaps.
     */
    public int lastVerse(String bookId, int chapter) {
        NavigableMap<Integer, String> verses = chapter(bookId, chapter);
        return verses.isEmpty() ? 0 : verses.lastKey();
    }

    public boolean hasBook(String bookId) {
        return books.containsKey(bookId);
    }

    public int bookCount() {
        return books.size();
    }

    public int verseCount() {
        return verseCount;
    }

    @Override
    public String toString() {
        return "TranslationTable[" + translationId + ", " + books.size() + " books, " + verseCount + " verses]";
    }

    public static final class Builder {
        private final String translationId;
        private final Map<String, TreeMap<Integer, TreeMap<Integer, String>>> books = new HashMap<>();

        private Builder(String translationId) {
            this.translationId = translationId;
        }

        /**
         * Adds a verse; a repeated (book, chapter, verse) replaces the earlier text.
         */
        public Builder verse(String bookId, int chapter, int verse, String text) {
            books.computeIfAbsent(bookId, k -> new TreeMap<>())
                .computeIfAbsent(chapter, k -> new TreeMap<>())
                .put(verse, text);
            return this;
        }

        public TranslationTable build() {
            Map<String, NavigableMap<Integer, NavigableMap<Integer, String>>> frozen = new HashMap<>();
            int count = 0;
            for (Map.Entry<String, TreeMap<Integer, TreeMap<Integer, String>>> book : books.entrySet()) {
                TreeMap<Integer, NavigableMap<Integer, String>> chapters = new TreeMap<>();
                for (Map.Entry<Integer, TreeMap<Integer, String>> chapter : book.getValue().entrySet()) {
                    chapters.put(chapter.getKey(),
                        Collections.unmodifiableNavigableMap(new TreeMap<>(chapter.getValue())));
                    count += chapter.getValue().size();
                }
                frozen.put(book.getKey(), Collections.unmodifiableNavigableMap(chapters));
            }
            return new TranslationTable(translationId, Map.copyOf(frozen), count);
        }
    }
}
