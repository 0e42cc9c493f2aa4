package io.github.nicechester.scripture.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aramaic portions of one book, as scattered verses and/or contiguous spans.
 * Partially Aramaic verses count as wholly Aramaic.
 */
public record AramaicPassageRef(Set<String> verses, List<ChapterRange> ranges) {

    /**
     * Span from (chapterStart:verseStart) through (chapterEnd:verseEnd).
     */
    public record ChapterRange(int chapterStart, int verseStart, int chapterEnd, int verseEnd) {

        public ChapterRange {
            if (chapterStart < 1 || verseStart < 1 || chapterEnd < chapterStart || verseEnd < 1) {
                throw new IllegalArgumentException("Invalid chapter range "
                    + chapterStart + ":" + verseStart + "-" + chapterEnd + ":" + verseEnd);
            }
        }

        public boolean contains(int chapter, int verse) {
            return (chapter == chapterStart && verse >= verseStart)
                || (chapter == chapterEnd && verse <= verseEnd)
                || (chapter > chapterStart && chapter < chapterEnd);
        }
    }

    public AramaicPassageRef {
        verses = Set.copyOf(verses);
        ranges = List.copyOf(ranges);
    }

    public static AramaicPassageRef ofRanges(ChapterRange... ranges) {
        return new AramaicPassageRef(Set.of(), List.of(ranges));
    }

    public static AramaicPassageRef ofVerses(Set<String> verses) {
        return new AramaicPassageRef(verses, List.of());
    }

    /**
     * Collects "chapter-verse" keys for verseStart..verseEnd of one chapter.
     */
    public static Set<String> verseSpan(int chapter, int verseStart, int verseEnd) {
        Set<String> keys = new HashSet<>();
        for (int verse = verseStart; verse <= verseEnd; verse++) {
            keys.add(key(chapter, verse));
        }
        return keys;
    }

    public static String key(int chapter, int verse) {
        return chapter + "-" + verse;
    }

    public boolean contains(int chapter, int verse) {
        if (verses.contains(key(chapter, verse))) {
            return true;
        }
        for (ChapterRange range : ranges) {
            if (range.contains(chapter, verse)) {
                return true;
            }
        }
        return false;
    }
}
