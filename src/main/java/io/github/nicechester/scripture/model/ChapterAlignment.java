package io.github.nicechester.scripture.model;

/**
 * Verse numbering alignment of one chapter between the source-language text
 * and the destination (reference translation) numbering.
 *
 * @param offset verses of the source text taken up by an unnumbered
 *               superscription in the destination text (0, 1 or 2)
 */
public record ChapterAlignment(String bookId, int chapter, int offset) {

    public ChapterAlignment {
        if (offset < 0 || offset > 2) {
            throw new IllegalArgumentException("offset must be 0, 1 or 2: " + offset);
        }
    }

    public static ChapterAlignment identity(String bookId, int chapter) {
        return new ChapterAlignment(bookId, chapter, 0);
    }

    /**
     * Source-language verse holding the text of a logical (destination) verse.
     */
    public int sourceVerse(int logicalVerse) {
        return logicalVerse + offset;
    }

    /**
     * Verse number to read from a translation's own table.
     */
    public int physicalVerse(int logicalVerse, boolean followsSourceNumbering) {
        return followsSourceNumbering ? logicalVerse + offset : logicalVerse;
    }

    public boolean hasSuperscription() {
        return offset > 0;
    }
}
