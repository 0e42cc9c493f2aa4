package io.github.nicechester.scripture.service;

import io.github.nicechester.scripture.model.ChapterAlignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Aligns Masoretic (source) verse numbering with English (destination) numbering.
 *
 * <p>Psalm superscriptions are verse 1 (sometimes verses 1-2) in the Hebrew text
 * but unnumbered in English Bibles, so the Hebrew chapter runs one or two verses
 * longer and Hebrew verse N+offset carries English verse N. Other books and
 * other count mismatches are left unaligned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersificationAligner {

    private final BookCatalog bookCatalog;

    /**
     * Superscription offset for a chapter: sourceVerseCount - destVerseCount
     * when that is 1 or 2 and the book is Psalms, otherwise 0.
     */
    public int computeOffset(String bookName, int chapter, int sourceVerseCount, int destVerseCount) {
        if (!appliesTo(bookName)) {
            return 0;
        }
        int diff = sourceVerseCount - destVerseCount;
        if (diff == 1 || diff == 2) {
            log.debug("Psalm {} carries a superscription: source={} verses, destination={} verses",
                chapter, sourceVerseCount, destVerseCount);
            return diff;
        }
        return 0;
    }

    public ChapterAlignment align(String bookName, int chapter, int sourceVerseCount, int destVerseCount) {
        int offset = computeOffset(bookName, chapter, sourceVerseCount, destVerseCount);
        return new ChapterAlignment(bookCatalog.canonicalId(bookName), chapter, offset);
    }

    /**
     * Source verse holding destination verse {@code destVerseNumber}.
     */
    public int resolveSourceVerse(int destVerseNumber, int offset) {
        return destVerseNumber + offset;
    }

    /**
     * Inverse of {@link #resolveSourceVerse}. Returns 0 for source verses that
     * are part of the superscription and have no destination number.
     */
    public int toDestinationVerse(int sourceVerseNumber, int offset) {
        int dest = sourceVerseNumber - offset;
        return dest >= 1 ? dest : 0;
    }

    /**
     * Verse to read from a translation's own table for a logical verse.
     */
    public int physicalVerse(int logicalVerse, int offset, boolean followsSourceNumbering) {
        return followsSourceNumbering ? logicalVerse + offset : logicalVerse;
    }

    /**
     * Whether a book can carry a non-zero offset.
     */
    public boolean appliesTo(String bookName) {
        return bookName != null && bookCatalog.isPsalms(bookName);
    }
}
